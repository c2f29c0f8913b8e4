package com.tutorhub.backend.global.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Fixed directed graph of legal status changes for one aggregate type.
 */
public final class StatusTransitions<S extends Enum<S>> {

    private final String aggregateType;
    private final Map<S, Set<S>> edges;

    private StatusTransitions(String aggregateType, Map<S, Set<S>> edges) {
        this.aggregateType = aggregateType;
        this.edges = edges;
    }

    public static <S extends Enum<S>> Builder<S> builder(String aggregateType, Class<S> statusType) {
        return new Builder<>(aggregateType, statusType);
    }

    public boolean allows(S from, S to) {
        return from != null && to != null && edges.getOrDefault(from, Set.of()).contains(to);
    }

    public Set<S> targetsFrom(S from) {
        return edges.getOrDefault(from, Set.of());
    }

    public void require(S from, S to) {
        if (!allows(from, to)) {
            throw new InvalidTransitionException(aggregateType, from, to);
        }
    }

    public static final class Builder<S extends Enum<S>> {

        private final String aggregateType;
        private final Class<S> statusType;
        private final Map<S, Set<S>> edges;

        private Builder(String aggregateType, Class<S> statusType) {
            this.aggregateType = aggregateType;
            this.statusType = statusType;
            this.edges = new EnumMap<>(statusType);
        }

        public Builder<S> allow(S from, S to) {
            if (from == to) {
                throw new IllegalArgumentException("Self transitions are not allowed: " + from);
            }
            edges.computeIfAbsent(from, key -> EnumSet.noneOf(statusType)).add(to);
            return this;
        }

        public StatusTransitions<S> build() {
            Map<S, Set<S>> frozen = new EnumMap<>(statusType);
            edges.forEach((from, targets) -> frozen.put(from, Collections.unmodifiableSet(EnumSet.copyOf(targets))));
            return new StatusTransitions<>(aggregateType, Collections.unmodifiableMap(frozen));
        }
    }
}
