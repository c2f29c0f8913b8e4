package com.tutorhub.backend.modules.user.domain.rules;

public enum TutorTier {
    JUNIOR,
    SENIOR,
    EXPERT
}
