package com.tutorhub.backend.modules.matching.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record MatchingRequestResponse(
        UUID id,
        UUID studentId,
        String subject,
        String preferredExperienceLevel,
        BigDecimal maxHourlyRate,
        List<String> preferredLanguages,
        String description,
        String status,
        UUID matchedTutorId,
        String cancellationReason,
        OffsetDateTime requestedAt,
        OffsetDateTime expiresAt,
        OffsetDateTime closedAt
) {
}
