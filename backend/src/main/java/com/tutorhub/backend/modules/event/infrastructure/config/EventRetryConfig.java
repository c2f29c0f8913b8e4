package com.tutorhub.backend.modules.event.infrastructure.config;

import com.tutorhub.backend.modules.event.application.EventProperties;
import com.tutorhub.backend.modules.event.domain.PublishException;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EventRetryConfig {

    private static final Logger log = LoggerFactory.getLogger(EventRetryConfig.class);
    public static final String EVENT_PUBLISH_RETRY = "eventPublishRetry";

    @Bean
    public Retry eventPublishRetry(EventProperties properties) {
        return buildRetry(properties);
    }

    public static Retry buildRetry(EventProperties properties) {
        // exponential: initialBackoff, initialBackoff * multiplier, ...
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.initialBackoff().toMillis(),
                        properties.backoffMultiplier()))
                .retryExceptions(PublishException.class)
                .build();

        Retry retry = RetryRegistry.of(config).retry(EVENT_PUBLISH_RETRY);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying event publish attempt={} wait={}ms cause={}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        return retry;
    }
}
