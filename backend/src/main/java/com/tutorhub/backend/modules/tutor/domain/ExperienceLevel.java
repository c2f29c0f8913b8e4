package com.tutorhub.backend.modules.tutor.domain;

public enum ExperienceLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED,
    EXPERT;

    public boolean isAtLeast(ExperienceLevel other) {
        return other == null || compareTo(other) >= 0;
    }
}
