package com.tutorhub.backend.modules.user.domain.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thresholds used by {@link UserBusinessRules}, bound from {@code tutorhub.policy.*}.
 */
@ConfigurationProperties(prefix = "tutorhub.policy")
public record UserPolicy(
        @DefaultValue("7") int minRegistrationDaysForTutor,
        @DefaultValue("30") int emailChangeCooldownDays,
        @DefaultValue("3") int maxLoginAttempts,
        @DefaultValue("75") int minReputationForPremium,
        @DefaultValue("50") int minSessionsForSeniorTutor,
        @DefaultValue("80") int minReputationForSenior,
        @DefaultValue("90") int minReputationForExpert,
        @DefaultValue("0.15") double maxCancellationRate
) {

    public UserPolicy {
        if (minRegistrationDaysForTutor < 0 || emailChangeCooldownDays < 0 || maxLoginAttempts < 1
                || minSessionsForSeniorTutor < 0) {
            throw new IllegalArgumentException("tutorhub.policy day/attempt/session thresholds are out of range");
        }
        if (maxCancellationRate < 0.0 || maxCancellationRate > 1.0) {
            throw new IllegalArgumentException("tutorhub.policy.max-cancellation-rate must be within 0..1");
        }
    }

    public static UserPolicy defaults() {
        return new UserPolicy(7, 30, 3, 75, 50, 80, 90, 0.15);
    }
}
