package com.tutorhub.backend.modules.tutor.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorChanges;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

public record UpdateTutorRequest(
        String bio,
        Set<TutorSubject> subjects,
        ExperienceLevel experienceLevel,
        BigDecimal hourlyRate,
        String currency,
        List<String> languages,
        String education
) {

    public TutorChanges toChanges() {
        return new TutorChanges(bio, subjects, experienceLevel, hourlyRate, currency, languages, education);
    }
}
