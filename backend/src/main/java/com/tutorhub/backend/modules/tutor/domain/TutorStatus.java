package com.tutorhub.backend.modules.tutor.domain;

import com.tutorhub.backend.global.domain.StatusTransitions;

public enum TutorStatus {
    PENDING_APPROVAL,
    ACTIVE,
    SUSPENDED,
    INACTIVE;

    static final StatusTransitions<TutorStatus> TRANSITIONS = StatusTransitions.builder("tutor", TutorStatus.class)
            .allow(PENDING_APPROVAL, ACTIVE)
            .allow(PENDING_APPROVAL, INACTIVE)
            .allow(ACTIVE, SUSPENDED)
            .allow(ACTIVE, INACTIVE)
            .allow(SUSPENDED, ACTIVE)
            .allow(SUSPENDED, INACTIVE)
            .build();

    public boolean canTransitionTo(TutorStatus target) {
        return TRANSITIONS.allows(this, target);
    }
}
