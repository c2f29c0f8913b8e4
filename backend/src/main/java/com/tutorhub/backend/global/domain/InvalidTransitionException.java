package com.tutorhub.backend.global.domain;

public class InvalidTransitionException extends RuntimeException {

    private final String aggregateType;
    private final String from;
    private final String to;

    public InvalidTransitionException(String aggregateType, Enum<?> from, Enum<?> to) {
        super("Illegal " + aggregateType + " status transition " + from + " -> " + to);
        this.aggregateType = aggregateType;
        this.from = from.name();
        this.to = to.name();
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
