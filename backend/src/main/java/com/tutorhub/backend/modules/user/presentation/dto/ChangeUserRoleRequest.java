package com.tutorhub.backend.modules.user.presentation.dto;

import com.tutorhub.backend.modules.user.domain.UserRole;

import jakarta.validation.constraints.NotNull;

public record ChangeUserRoleRequest(
        @NotNull(message = "role is required")
        UserRole role
) {
}
