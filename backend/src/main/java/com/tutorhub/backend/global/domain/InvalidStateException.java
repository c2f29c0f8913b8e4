package com.tutorhub.backend.global.domain;

/**
 * The aggregate's current state does not permit the requested operation.
 */
public class InvalidStateException extends RuntimeException {

    private final String aggregateType;

    public InvalidStateException(String aggregateType, String message) {
        super(message);
        this.aggregateType = aggregateType;
    }

    public String getAggregateType() {
        return aggregateType;
    }
}
