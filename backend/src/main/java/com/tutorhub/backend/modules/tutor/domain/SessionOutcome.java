package com.tutorhub.backend.modules.tutor.domain;

public enum SessionOutcome {
    COMPLETED,
    CANCELLED
}
