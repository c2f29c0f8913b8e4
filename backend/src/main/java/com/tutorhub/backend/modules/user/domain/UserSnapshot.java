package com.tutorhub.backend.modules.user.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.global.domain.Email;

/**
 * Read-only view of a user, consumed by {@code UserBusinessRules}.
 */
public record UserSnapshot(
        UUID id,
        Email email,
        String firstName,
        String lastName,
        UserRole role,
        UserStatus status,
        String bio,
        List<String> skills,
        OffsetDateTime registeredAt,
        OffsetDateTime emailChangedAt,
        OffsetDateTime lastLoginAt,
        int failedLoginAttempts
) {

    public UserSnapshot {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
