package com.tutorhub.backend.modules.user.presentation.dto;

import java.util.UUID;

public record LoginAttemptResponse(
        UUID userId,
        String status,
        int failedAttempts,
        boolean locked
) {
}
