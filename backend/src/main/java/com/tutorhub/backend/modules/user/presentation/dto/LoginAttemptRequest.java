package com.tutorhub.backend.modules.user.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record LoginAttemptRequest(
        @NotNull(message = "success is required")
        Boolean success
) {
}
