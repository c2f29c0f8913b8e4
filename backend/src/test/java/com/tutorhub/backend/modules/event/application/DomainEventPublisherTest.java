package com.tutorhub.backend.modules.event.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.EventSource;
import com.tutorhub.backend.global.domain.PendingEvents;
import com.tutorhub.backend.modules.event.domain.EventFailureMode;
import com.tutorhub.backend.modules.event.domain.EventSink;
import com.tutorhub.backend.modules.event.domain.PublishException;
import com.tutorhub.backend.modules.event.infrastructure.config.EventRetryConfig;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DomainEventPublisherTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private EventSink eventSink;

    @Mock
    private DeadLetterRecorder deadLetterRecorder;

    @Test
    void publishesDrainedEventsInOrder() {
        DomainEventPublisher publisher = publisher(EventFailureMode.FAIL);
        TestSource source = new TestSource();
        DomainEvent first = event("thing.created");
        DomainEvent second = event("thing.updated");
        source.events.append(first);
        source.events.append(second);

        List<DomainEvent> published = publisher.publishPending(source);

        assertThat(published).containsExactly(first, second);
        assertThat(source.pendingEvents()).isEmpty();
        verify(eventSink).publish(first);
        verify(eventSink).publish(second);
    }

    @Test
    void transientFailureIsRetried() {
        DomainEventPublisher publisher = publisher(EventFailureMode.FAIL);
        DomainEvent event = event("thing.created");
        doThrow(new PublishException("down"))
                .doNothing()
                .when(eventSink).publish(event);

        publisher.publish(event);

        verify(eventSink, times(2)).publish(event);
        verify(deadLetterRecorder, never()).record(any(), anyInt(), any());
    }

    @Test
    @DisplayName("FAIL 모드에서는 재시도 소진 후 예외를 그대로 던진다")
    void failModeRethrowsAfterMaxAttempts() {
        DomainEventPublisher publisher = publisher(EventFailureMode.FAIL);
        DomainEvent event = event("thing.created");
        doThrow(new PublishException("down")).when(eventSink).publish(event);

        assertThatThrownBy(() -> publisher.publish(event)).isInstanceOf(PublishException.class);

        verify(eventSink, times(3)).publish(event);
        verify(deadLetterRecorder, never()).record(any(), anyInt(), any());
    }

    @Test
    void deadLetterModeParksTheEventAndReturnsNormally() {
        DomainEventPublisher publisher = publisher(EventFailureMode.DEAD_LETTER);
        DomainEvent event = event("thing.created");
        doThrow(new PublishException("down")).when(eventSink).publish(event);

        publisher.publish(event);

        verify(eventSink, times(3)).publish(event);
        verify(deadLetterRecorder).record(eq(event), eq(3), any(PublishException.class));
    }

    @Test
    void deadLetterWriteFailureSurfacesBothErrors() {
        DomainEventPublisher publisher = publisher(EventFailureMode.DEAD_LETTER);
        DomainEvent event = event("thing.created");
        doThrow(new PublishException("down")).when(eventSink).publish(event);
        when(deadLetterRecorder.record(eq(event), eq(3), any())).thenThrow(new IllegalStateException("db gone"));

        assertThatThrownBy(() -> publisher.publish(event))
                .isInstanceOf(PublishException.class)
                .satisfies(ex -> assertThat(ex.getSuppressed())
                        .singleElement()
                        .isInstanceOf(IllegalStateException.class));
    }

    @Test
    void transactionBoundSinkGetsSingleAttempt() {
        when(eventSink.joinsCallerTransaction()).thenReturn(true);
        DomainEventPublisher publisher = publisher(EventFailureMode.FAIL);
        DomainEvent event = event("thing.created");
        doThrow(new PublishException("constraint")).when(eventSink).publish(event);

        assertThatThrownBy(() -> publisher.publish(event)).isInstanceOf(PublishException.class);

        verify(eventSink, times(1)).publish(event);
        verify(deadLetterRecorder, never()).record(any(), anyInt(), any());
    }

    @Test
    void deadLetterModeIsRejectedForTransactionBoundSink() {
        when(eventSink.joinsCallerTransaction()).thenReturn(true);

        assertThatThrownBy(() -> publisher(EventFailureMode.DEAD_LETTER))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("DEAD_LETTER");
    }

    private DomainEventPublisher publisher(EventFailureMode mode) {
        EventProperties properties = new EventProperties(3, Duration.ofMillis(1), 1.0, mode);
        return new DomainEventPublisher(eventSink, EventRetryConfig.buildRetry(properties), properties,
                deadLetterRecorder);
    }

    private static DomainEvent event(String type) {
        return DomainEvent.of(type, "thing", UUID.randomUUID(), null, NOW, Map.of("k", "v"));
    }

    private static final class TestSource implements EventSource {

        private final PendingEvents events = new PendingEvents();

        @Override
        public List<DomainEvent> pendingEvents() {
            return events.view();
        }

        @Override
        public List<DomainEvent> drainEvents() {
            return events.drain();
        }
    }
}
