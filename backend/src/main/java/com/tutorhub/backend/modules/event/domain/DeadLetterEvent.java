package com.tutorhub.backend.modules.event.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tutorhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * An event that exhausted its publish retries. Kept for operator replay.
 */
@Entity
@Table(name = "dead_letter_event")
public class DeadLetterEvent extends AbstractTimestampedEntity {

    private static final int MAX_REASON_LENGTH = 1000;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "event_id", nullable = false, columnDefinition = "uuid")
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, columnDefinition = "uuid")
    private UUID aggregateId;

    @Column(name = "payload", nullable = false, length = 10000)
    private String payload;

    @Column(name = "failure_reason", length = MAX_REASON_LENGTH)
    private String failureReason;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "failed_at", nullable = false)
    private OffsetDateTime failedAt;

    protected DeadLetterEvent() {
    }

    public DeadLetterEvent(
            UUID eventId,
            String eventType,
            String aggregateType,
            UUID aggregateId,
            String payload,
            String failureReason,
            int attempts,
            OffsetDateTime failedAt
    ) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.payload = payload;
        this.failureReason = truncate(failureReason);
        this.attempts = attempts;
        this.failedAt = failedAt;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public String getPayload() {
        return payload;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public int getAttempts() {
        return attempts;
    }

    public OffsetDateTime getFailedAt() {
        return failedAt;
    }
}
