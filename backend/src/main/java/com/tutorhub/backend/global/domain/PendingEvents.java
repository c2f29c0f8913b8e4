package com.tutorhub.backend.global.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only event queue embedded in each aggregate.
 */
public final class PendingEvents {

    private final List<DomainEvent> events = new ArrayList<>();

    public void append(DomainEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    public List<DomainEvent> view() {
        return List.copyOf(events);
    }

    public List<DomainEvent> drain() {
        if (events.isEmpty()) {
            return List.of();
        }
        List<DomainEvent> drained = List.copyOf(events);
        events.clear();
        return drained;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
