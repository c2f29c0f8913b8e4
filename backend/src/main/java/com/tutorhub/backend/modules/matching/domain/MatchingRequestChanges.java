package com.tutorhub.backend.modules.matching.domain;

import java.math.BigDecimal;
import java.util.List;

import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

/**
 * Partial update of a pending request; {@code null} components are left as they are.
 */
public record MatchingRequestChanges(
        TutorSubject subject,
        ExperienceLevel preferredExperienceLevel,
        BigDecimal maxHourlyRate,
        List<String> preferredLanguages,
        String description
) {
}
