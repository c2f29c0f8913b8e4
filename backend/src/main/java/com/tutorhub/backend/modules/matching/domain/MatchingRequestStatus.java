package com.tutorhub.backend.modules.matching.domain;

import com.tutorhub.backend.global.domain.StatusTransitions;

public enum MatchingRequestStatus {
    PENDING,
    MATCHED,
    CANCELLED,
    EXPIRED;

    static final StatusTransitions<MatchingRequestStatus> TRANSITIONS =
            StatusTransitions.builder("matching_request", MatchingRequestStatus.class)
                    .allow(PENDING, MATCHED)
                    .allow(PENDING, CANCELLED)
                    .allow(PENDING, EXPIRED)
                    .build();

    public boolean isTerminal() {
        return TRANSITIONS.targetsFrom(this).isEmpty();
    }
}
