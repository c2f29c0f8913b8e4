package com.tutorhub.backend.global.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of a state change queued by an aggregate and published after commit.
 */
public record DomainEvent(
        UUID eventId,
        String eventType,
        String aggregateType,
        UUID aggregateId,
        UUID actorId,
        OffsetDateTime occurredAt,
        Map<String, Object> payload
) {

    public DomainEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(occurredAt, "occurredAt");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static DomainEvent of(
            String eventType,
            String aggregateType,
            UUID aggregateId,
            UUID actorId,
            OffsetDateTime occurredAt,
            Map<String, Object> payload
    ) {
        return new DomainEvent(UUID.randomUUID(), eventType, aggregateType, aggregateId, actorId, occurredAt, payload);
    }
}
