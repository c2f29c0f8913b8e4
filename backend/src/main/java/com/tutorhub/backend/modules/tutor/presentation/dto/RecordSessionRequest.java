package com.tutorhub.backend.modules.tutor.presentation.dto;

import com.tutorhub.backend.modules.tutor.domain.SessionOutcome;

import jakarta.validation.constraints.NotNull;

public record RecordSessionRequest(
        @NotNull(message = "outcome is required")
        SessionOutcome outcome
) {
}
