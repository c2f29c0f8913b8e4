package com.tutorhub.backend.modules.event.domain;

/**
 * What the publisher does once retries are exhausted.
 */
public enum EventFailureMode {
    /** Rethrow so the surrounding use-case transaction rolls back. */
    FAIL,
    /** Keep the state change, park the event in the dead-letter table and raise an alert. */
    DEAD_LETTER
}
