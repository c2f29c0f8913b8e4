package com.tutorhub.backend.modules.tutor.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.NewTutor;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

public record CreateTutorRequest(
        UUID userId,
        String bio,
        Set<TutorSubject> subjects,
        ExperienceLevel experienceLevel,
        BigDecimal hourlyRate,
        String currency,
        List<String> languages,
        String education
) {

    public NewTutor toNewTutor() {
        return new NewTutor(userId, bio, subjects, experienceLevel, hourlyRate, currency, languages, education);
    }
}
