package com.tutorhub.backend.modules.user.presentation.dto;

import com.tutorhub.backend.modules.user.domain.UserStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ChangeUserStatusRequest(
        @NotNull(message = "status is required")
        UserStatus status,
        @Size(max = 200, message = "reason must not exceed 200 characters")
        String reason
) {
}
