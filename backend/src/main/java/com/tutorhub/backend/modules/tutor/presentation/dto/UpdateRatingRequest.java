package com.tutorhub.backend.modules.tutor.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotNull;

public record UpdateRatingRequest(
        @NotNull(message = "rating is required")
        BigDecimal rating,
        @NotNull(message = "totalReviews is required")
        Integer totalReviews
) {
}
