package com.tutorhub.backend.global.domain;

import java.util.List;

/**
 * Implemented by aggregates that queue domain events until they are committed.
 */
public interface EventSource {

    /**
     * Events queued since the last drain, oldest first. Read-only view.
     */
    List<DomainEvent> pendingEvents();

    /**
     * Returns the queued events and clears the queue. A second call returns an empty list.
     */
    List<DomainEvent> drainEvents();
}
