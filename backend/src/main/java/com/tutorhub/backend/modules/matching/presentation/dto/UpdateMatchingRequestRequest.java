package com.tutorhub.backend.modules.matching.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.tutorhub.backend.modules.matching.domain.MatchingRequestChanges;
import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

public record UpdateMatchingRequestRequest(
        TutorSubject subject,
        ExperienceLevel preferredExperienceLevel,
        BigDecimal maxHourlyRate,
        List<String> preferredLanguages,
        String description
) {

    public MatchingRequestChanges toChanges() {
        return new MatchingRequestChanges(subject, preferredExperienceLevel, maxHourlyRate, preferredLanguages, description);
    }
}
