package com.tutorhub.backend.modules.tutor.presentation.dto;

import java.util.UUID;

public record TutorTierResponse(
        UUID tutorId,
        String tier,
        int completedSessions,
        int reputationScore,
        double cancellationRate
) {
}
