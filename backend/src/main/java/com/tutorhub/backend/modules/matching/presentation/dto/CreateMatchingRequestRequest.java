package com.tutorhub.backend.modules.matching.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.matching.domain.NewMatchingRequest;
import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

public record CreateMatchingRequestRequest(
        UUID studentId,
        TutorSubject subject,
        ExperienceLevel preferredExperienceLevel,
        BigDecimal maxHourlyRate,
        List<String> preferredLanguages,
        String description
) {

    public NewMatchingRequest toNewRequest() {
        return new NewMatchingRequest(
                studentId,
                subject,
                preferredExperienceLevel,
                maxHourlyRate,
                preferredLanguages,
                description
        );
    }
}
