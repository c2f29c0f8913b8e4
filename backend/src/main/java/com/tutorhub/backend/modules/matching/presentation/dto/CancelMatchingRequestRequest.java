package com.tutorhub.backend.modules.matching.presentation.dto;

import jakarta.validation.constraints.Size;

public record CancelMatchingRequestRequest(
        @Size(max = 500, message = "reason must not exceed 500 characters")
        String reason
) {
}
