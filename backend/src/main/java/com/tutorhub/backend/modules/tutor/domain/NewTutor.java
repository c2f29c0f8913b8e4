package com.tutorhub.backend.modules.tutor.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Input for {@link Tutor#create}. {@code currency} defaults to USD.
 */
public record NewTutor(
        UUID userId,
        String bio,
        Set<TutorSubject> subjects,
        ExperienceLevel experienceLevel,
        BigDecimal hourlyRate,
        String currency,
        List<String> languages,
        String education
) {
}
