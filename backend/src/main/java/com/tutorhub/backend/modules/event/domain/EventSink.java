package com.tutorhub.backend.modules.event.domain;

import com.tutorhub.backend.global.domain.DomainEvent;

/**
 * Destination for committed domain events.
 */
public interface EventSink {

    /**
     * @throws PublishException when the event could not be accepted; callers may retry
     */
    void publish(DomainEvent event);

    /**
     * {@code true} when {@link #publish} writes inside the caller's transaction. A failure then
     * marks that transaction rollback-only, so it can neither be retried nor dead-lettered.
     */
    default boolean joinsCallerTransaction() {
        return false;
    }
}
