package com.tutorhub.backend.modules.event.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.modules.event.domain.DeadLetterEvent;
import com.tutorhub.backend.modules.event.infrastructure.outbox.EventPayloadSerializer;
import com.tutorhub.backend.modules.event.infrastructure.persistence.DeadLetterEventRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 발행에 실패한 이벤트를 {@code dead_letter_event}에 보관한다.
 * 별도 트랜잭션에서 기록하므로 호출 측 트랜잭션이 롤백되어도 남는다.
 */
@Service
public class DeadLetterRecorder {

    private final DeadLetterEventRepository deadLetterEventRepository;
    private final EventPayloadSerializer serializer;
    private final Clock clock;

    public DeadLetterRecorder(
            DeadLetterEventRepository deadLetterEventRepository,
            EventPayloadSerializer serializer,
            Clock clock
    ) {
        this.deadLetterEventRepository = deadLetterEventRepository;
        this.serializer = serializer;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DeadLetterEvent record(DomainEvent event, int attempts, Throwable cause) {
        DeadLetterEvent entry = new DeadLetterEvent(
                event.eventId(),
                event.eventType(),
                event.aggregateType(),
                event.aggregateId(),
                serializer.toJson(event),
                cause != null ? cause.getMessage() : null,
                attempts,
                OffsetDateTime.now(clock)
        );
        return deadLetterEventRepository.save(entry);
    }
}
