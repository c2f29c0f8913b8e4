package com.tutorhub.backend.support;

import static org.mockito.Mockito.mock;

import java.time.Duration;

import com.tutorhub.backend.modules.event.application.DeadLetterRecorder;
import com.tutorhub.backend.modules.event.application.DomainEventPublisher;
import com.tutorhub.backend.modules.event.application.EventProperties;
import com.tutorhub.backend.modules.event.domain.EventFailureMode;
import com.tutorhub.backend.modules.event.domain.EventSink;
import com.tutorhub.backend.modules.event.infrastructure.config.EventRetryConfig;

public final class TestEventPublishers {

    private TestEventPublishers() {
    }

    /**
     * Publisher with three fast attempts that rethrows once they are used up.
     */
    public static DomainEventPublisher failing(EventSink sink) {
        EventProperties properties = new EventProperties(3, Duration.ofMillis(1), 1.0, EventFailureMode.FAIL);
        return new DomainEventPublisher(
                sink,
                EventRetryConfig.buildRetry(properties),
                properties,
                mock(DeadLetterRecorder.class)
        );
    }
}
