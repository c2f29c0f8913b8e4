package com.tutorhub.backend.modules.tutor.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public record TutorResponse(
        UUID id,
        UUID userId,
        String bio,
        List<String> subjects,
        String experienceLevel,
        BigDecimal hourlyRate,
        String currency,
        List<String> languages,
        String education,
        String status,
        BigDecimal rating,
        int totalReviews,
        int completedSessions,
        int cancelledSessions
) {
}
