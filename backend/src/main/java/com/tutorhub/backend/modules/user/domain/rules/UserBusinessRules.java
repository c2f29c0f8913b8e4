package com.tutorhub.backend.modules.user.domain.rules;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.modules.user.domain.UserRole;
import com.tutorhub.backend.modules.user.domain.UserSnapshot;
import com.tutorhub.backend.modules.user.domain.UserStatus;

import org.springframework.stereotype.Component;

/**
 * Stateless eligibility checks over a {@link UserSnapshot}. A negative answer is a {@code false}
 * or a lower tier, never an exception; malformed numeric input is a {@link ValidationException}.
 */
@Component
public class UserBusinessRules {

    private static final long SECONDS_PER_DAY = Duration.ofDays(1).getSeconds();

    private final UserPolicy policy;

    public UserBusinessRules(UserPolicy policy) {
        this.policy = policy;
    }

    public boolean canBecomeTutor(UserSnapshot user, OffsetDateTime now) {
        return canBecomeTutor(user, now, policy.minRegistrationDaysForTutor());
    }

    public boolean canBecomeTutor(UserSnapshot user, OffsetDateTime now, int minRegistrationDays) {
        if (minRegistrationDays < 0) {
            throw ValidationException.of("minRegistrationDays", "negative", "must be zero or greater");
        }
        return user.role() == UserRole.STUDENT
                && user.status() == UserStatus.ACTIVE
                && accountAgeDays(user, now) >= minRegistrationDays;
    }

    public boolean canTransitionRole(UserRole from, UserRole to, UserSnapshot user, OffsetDateTime now) {
        if (from == null || to == null || from == to) {
            return false;
        }
        if (from.isPrivileged() || to.isPrivileged()) {
            return false;
        }
        if (user.status() != UserStatus.ACTIVE) {
            return false;
        }
        if (from == UserRole.STUDENT && to == UserRole.TUTOR) {
            return canBecomeTutor(user, now);
        }
        return true;
    }

    public boolean canChangeEmail(UserSnapshot user, Email newEmail, OffsetDateTime now) {
        if (user.status() != UserStatus.ACTIVE) {
            return false;
        }
        if (newEmail == null || newEmail.equals(user.email())) {
            return false;
        }
        OffsetDateTime lastChange = user.emailChangedAt();
        if (lastChange == null) {
            return true;
        }
        return !now.isBefore(lastChange.plusDays(policy.emailChangeCooldownDays()));
    }

    public boolean shouldLockAccount(UserSnapshot user, int failedAttempts) {
        if (failedAttempts < 0) {
            throw ValidationException.of("failedAttempts", "negative", "must be zero or greater");
        }
        if (user.status() != UserStatus.ACTIVE) {
            return true;
        }
        return failedAttempts >= policy.maxLoginAttempts();
    }

    public boolean hasPremiumAccess(UserSnapshot user, int reputationScore) {
        requireScore(reputationScore);
        if (user.role().isPrivileged()) {
            return true;
        }
        return reputationScore >= policy.minReputationForPremium();
    }

    public TutorTier tutorTier(int completedSessions, int reputationScore, double cancellationRate) {
        if (completedSessions < 0) {
            throw ValidationException.of("completedSessions", "negative", "must be zero or greater");
        }
        requireScore(reputationScore);
        if (Double.isNaN(cancellationRate) || cancellationRate < 0.0 || cancellationRate > 1.0) {
            throw ValidationException.of("cancellationRate", "out_of_range", "must be between 0 and 1");
        }
        if (cancellationRate > policy.maxCancellationRate()) {
            return TutorTier.JUNIOR;
        }
        if (completedSessions >= policy.minSessionsForSeniorTutor()
                && reputationScore >= policy.minReputationForSenior()) {
            return reputationScore >= policy.minReputationForExpert() ? TutorTier.EXPERT : TutorTier.SENIOR;
        }
        return TutorTier.JUNIOR;
    }

    /**
     * Whole days since registration, rounded down.
     */
    public long accountAgeDays(UserSnapshot user, OffsetDateTime now) {
        long seconds = Duration.between(user.registeredAt(), now).getSeconds();
        return Math.floorDiv(seconds, SECONDS_PER_DAY);
    }

    public boolean isProfileComplete(UserSnapshot user) {
        return user.status() == UserStatus.ACTIVE
                && user.email() != null
                && hasText(user.firstName())
                && hasText(user.lastName());
    }

    public UserPolicy policy() {
        return policy;
    }

    private static void requireScore(int reputationScore) {
        if (reputationScore < 0 || reputationScore > 100) {
            throw ValidationException.of("reputationScore", "out_of_range", "must be between 0 and 100");
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
