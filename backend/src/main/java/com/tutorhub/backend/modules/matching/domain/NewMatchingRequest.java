package com.tutorhub.backend.modules.matching.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

public record NewMatchingRequest(
        UUID studentId,
        TutorSubject subject,
        ExperienceLevel preferredExperienceLevel,
        BigDecimal maxHourlyRate,
        List<String> preferredLanguages,
        String description
) {
}
