package com.tutorhub.backend.modules.matching.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Matching request lifecycle settings bound from {@code tutorhub.matching.*}.
 *
 * @param requestTtl       how long a request stays open before it can be expired
 * @param expiryBatchSize  upper bound of requests expired per sweep
 */
@ConfigurationProperties(prefix = "tutorhub.matching")
public record MatchingProperties(
        @DefaultValue("7d") Duration requestTtl,
        @DefaultValue("100") int expiryBatchSize
) {

    public MatchingProperties {
        if (requestTtl == null || requestTtl.isNegative() || requestTtl.isZero()) {
            throw new IllegalArgumentException("tutorhub.matching.request-ttl must be positive");
        }
        if (expiryBatchSize < 1) {
            throw new IllegalArgumentException("tutorhub.matching.expiry-batch-size must be >= 1");
        }
    }

    public static MatchingProperties defaults() {
        return new MatchingProperties(Duration.ofDays(7), 100);
    }
}
