package com.tutorhub.backend.modules.user.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record UserResponse(
        UUID id,
        String email,
        String firstName,
        String lastName,
        String role,
        String status,
        String bio,
        List<String> skills,
        OffsetDateTime registeredAt,
        OffsetDateTime emailChangedAt,
        OffsetDateTime lastLoginAt,
        int failedLoginAttempts
) {
}
