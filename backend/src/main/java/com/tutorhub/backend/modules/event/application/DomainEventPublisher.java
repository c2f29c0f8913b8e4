package com.tutorhub.backend.modules.event.application;

import java.util.List;

import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.EventSource;
import com.tutorhub.backend.modules.event.domain.EventFailureMode;
import com.tutorhub.backend.modules.event.domain.EventSink;
import com.tutorhub.backend.modules.event.domain.PublishException;

import io.github.resilience4j.retry.Retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single path from an aggregate's pending events to the {@link EventSink}.
 *
 * <p>Each event gets up to {@code tutorhub.events.max-attempts} tries with exponential backoff.
 * When they are exhausted the configured {@link EventFailureMode} decides the outcome:
 * {@code FAIL} rethrows so the use case rolls back; {@code DEAD_LETTER} parks the event and
 * lets the state change commit.</p>
 *
 * <p>A sink that {@linkplain EventSink#joinsCallerTransaction() joins the caller's transaction}
 * gets a single attempt: its failure has already doomed the transaction. Such a sink cannot be
 * combined with {@code DEAD_LETTER}; that pairing is rejected at startup.</p>
 */
@Service
public class DomainEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(DomainEventPublisher.class);

    private final EventSink eventSink;
    private final Retry retry;
    private final EventProperties properties;
    private final DeadLetterRecorder deadLetterRecorder;

    public DomainEventPublisher(
            EventSink eventSink,
            Retry eventPublishRetry,
            EventProperties properties,
            DeadLetterRecorder deadLetterRecorder
    ) {
        this.eventSink = eventSink;
        this.retry = eventPublishRetry;
        this.properties = properties;
        this.deadLetterRecorder = deadLetterRecorder;
        if (eventSink.joinsCallerTransaction() && properties.failureMode() == EventFailureMode.DEAD_LETTER) {
            throw new IllegalStateException("tutorhub.events.failure-mode=DEAD_LETTER requires an event sink "
                    + "outside the use-case transaction, but " + eventSink.getClass().getSimpleName()
                    + " writes inside it");
        }
    }

    /**
     * Drains the source and publishes what it held, in order.
     */
    public List<DomainEvent> publishPending(EventSource source) {
        List<DomainEvent> events = source.drainEvents();
        events.forEach(this::publish);
        return events;
    }

    public void publish(DomainEvent event) {
        if (eventSink.joinsCallerTransaction()) {
            try {
                eventSink.publish(event);
            } catch (PublishException ex) {
                handleExhausted(event, ex, 1);
            }
            return;
        }
        try {
            retry.executeRunnable(() -> eventSink.publish(event));
        } catch (PublishException ex) {
            handleExhausted(event, ex, properties.maxAttempts());
        }
    }

    private void handleExhausted(DomainEvent event, PublishException ex, int attempts) {
        if (properties.failureMode() == EventFailureMode.FAIL) {
            log.error("Event publish failed after {} attempts eventType={} aggregateId={}",
                    attempts, event.eventType(), event.aggregateId());
            throw ex;
        }
        try {
            deadLetterRecorder.record(event, attempts, ex);
        } catch (RuntimeException dlqEx) {
            log.error("[ALERT] Dead-letter write failed, event lost unless the request is retried "
                    + "eventId={} eventType={}", event.eventId(), event.eventType(), dlqEx);
            PublishException failure = new PublishException("Event could not be published or dead-lettered", ex);
            failure.addSuppressed(dlqEx);
            throw failure;
        }
        log.warn("[ALERT] Event moved to dead letter after {} attempts, state change committed without it "
                        + "eventId={} eventType={} aggregateId={}",
                attempts, event.eventId(), event.eventType(), event.aggregateId());
    }
}
