package com.tutorhub.backend.modules.tutor.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Partial profile update; {@code null} components are left as they are.
 */
public record TutorChanges(
        String bio,
        Set<TutorSubject> subjects,
        ExperienceLevel experienceLevel,
        BigDecimal hourlyRate,
        String currency,
        List<String> languages,
        String education
) {
}
