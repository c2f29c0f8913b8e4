package com.tutorhub.backend.modules.user.presentation.dto;

import java.util.UUID;

public record EligibilityResponse(
        UUID userId,
        long accountAgeDays,
        boolean canBecomeTutor,
        boolean hasPremiumAccess,
        boolean shouldLockAccount,
        boolean profileComplete
) {
}
