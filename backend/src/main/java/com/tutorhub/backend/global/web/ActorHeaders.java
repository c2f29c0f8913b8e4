package com.tutorhub.backend.global.web;

import java.util.UUID;

import com.tutorhub.backend.global.domain.Identifier;

/**
 * Resolves the acting user from the {@code X-Actor-Id} header. Authentication is handled
 * upstream; this service trusts the header value.
 */
public final class ActorHeaders {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";

    private ActorHeaders() {
    }

    public static UUID parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        return Identifier.of("actorId", headerValue).value();
    }
}
