package com.tutorhub.backend.modules.user.domain;

import com.tutorhub.backend.global.domain.StatusTransitions;

public enum UserStatus {
    PENDING_VERIFICATION,
    ACTIVE,
    SUSPENDED,
    DEACTIVATED;

    static final StatusTransitions<UserStatus> TRANSITIONS = StatusTransitions.builder("user", UserStatus.class)
            .allow(PENDING_VERIFICATION, ACTIVE)
            .allow(PENDING_VERIFICATION, DEACTIVATED)
            .allow(ACTIVE, SUSPENDED)
            .allow(ACTIVE, DEACTIVATED)
            .allow(SUSPENDED, ACTIVE)
            .allow(SUSPENDED, DEACTIVATED)
            .allow(DEACTIVATED, ACTIVE)
            .build();

    public boolean canTransitionTo(UserStatus target) {
        return TRANSITIONS.allows(this, target);
    }

    public boolean isActive() {
        return this == ACTIVE;
    }
}
