package com.tutorhub.backend.modules.tutor.presentation.dto;

import com.tutorhub.backend.modules.tutor.domain.TutorStatus;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ChangeTutorStatusRequest(
        @NotNull(message = "status is required")
        TutorStatus status,
        @Size(max = 200, message = "reason must not exceed 200 characters")
        String reason
) {
}
