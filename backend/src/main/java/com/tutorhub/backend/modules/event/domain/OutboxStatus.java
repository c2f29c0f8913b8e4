package com.tutorhub.backend.modules.event.domain;

/**
 * PENDING rows are waiting for a relay; PUBLISHED and FAILED are set by that relay.
 */
public enum OutboxStatus {
    PENDING,
    PUBLISHED,
    FAILED
}
