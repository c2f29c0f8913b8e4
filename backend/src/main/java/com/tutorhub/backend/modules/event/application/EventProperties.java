package com.tutorhub.backend.modules.event.application;

import java.time.Duration;

import com.tutorhub.backend.modules.event.domain.EventFailureMode;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Publishing policy bound from {@code tutorhub.events.*}.
 *
 * @param maxAttempts      total publish attempts per event, first try included
 * @param initialBackoff   wait before the first retry
 * @param backoffMultiplier growth factor between consecutive retries
 * @param failureMode      what happens when all attempts fail
 */
@ConfigurationProperties(prefix = "tutorhub.events")
public record EventProperties(
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("200ms") Duration initialBackoff,
        @DefaultValue("2.0") double backoffMultiplier,
        @DefaultValue("FAIL") EventFailureMode failureMode
) {

    public EventProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("tutorhub.events.max-attempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("tutorhub.events.initial-backoff must be positive");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("tutorhub.events.backoff-multiplier must be >= 1.0");
        }
        if (failureMode == null) {
            failureMode = EventFailureMode.FAIL;
        }
    }
}
