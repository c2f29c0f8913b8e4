package com.tutorhub.backend.modules.event.infrastructure.outbox;

import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.modules.event.domain.EventSink;
import com.tutorhub.backend.modules.event.domain.OutboxEvent;
import com.tutorhub.backend.modules.event.domain.PublishException;
import com.tutorhub.backend.modules.event.infrastructure.persistence.OutboxEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 호출 측 트랜잭션 안에서 {@code outbox_event}에 이벤트를 기록한다.
 * 상태 변경이 커밋될 때에만 이벤트 행도 남는다.
 */
@Component
public class OutboxEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(OutboxEventSink.class);

    private final OutboxEventRepository outboxEventRepository;
    private final EventPayloadSerializer serializer;

    public OutboxEventSink(OutboxEventRepository outboxEventRepository, EventPayloadSerializer serializer) {
        this.outboxEventRepository = outboxEventRepository;
        this.serializer = serializer;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void publish(DomainEvent event) {
        OutboxEvent row = new OutboxEvent(
                event.eventId(),
                event.eventType(),
                event.aggregateType(),
                event.aggregateId(),
                event.actorId(),
                event.occurredAt(),
                serializer.toJson(event)
        );
        try {
            // 제약 위반이 커밋 시점이 아니라 여기서 PublishException으로 드러나도록 즉시 flush
            outboxEventRepository.saveAndFlush(row);
        } catch (DataAccessException ex) {
            throw new PublishException("Failed to append " + event.eventType() + " to outbox", ex);
        }
        log.debug("Outbox append eventType={} aggregateId={} eventId={}",
                event.eventType(), event.aggregateId(), event.eventId());
    }

    @Override
    public boolean joinsCallerTransaction() {
        return true;
    }
}
