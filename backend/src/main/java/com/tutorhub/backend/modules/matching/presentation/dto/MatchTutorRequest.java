package com.tutorhub.backend.modules.matching.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record MatchTutorRequest(
        @NotNull(message = "tutorId is required")
        UUID tutorId
) {
}
