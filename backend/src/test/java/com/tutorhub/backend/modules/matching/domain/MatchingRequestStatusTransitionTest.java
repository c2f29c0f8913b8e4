package com.tutorhub.backend.modules.matching.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import com.tutorhub.backend.global.domain.InvalidTransitionException;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * The request has no generic transition operation; each closing status is reached through its own command.
 */
class MatchingRequestStatusTransitionTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final Duration TTL = Duration.ofDays(7);
    private static final OffsetDateTime AFTER_EXPIRY = NOW.plus(TTL).plusMinutes(1);

    static Stream<Arguments> closingCommands() {
        return Arrays.stream(MatchingRequestStatus.values())
                .flatMap(from -> Stream.of(MatchingRequestStatus.MATCHED, MatchingRequestStatus.CANCELLED,
                        MatchingRequestStatus.EXPIRED).map(to -> Arguments.of(from, to)));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("closingCommands")
    void onlyPendingRequestsClose(MatchingRequestStatus from, MatchingRequestStatus to) {
        MatchingRequest request = requestIn(from);

        if (from == MatchingRequestStatus.PENDING) {
            apply(request, to);

            assertThat(request.getStatus()).isEqualTo(to);
            assertThat(request.getClosedAt()).isNotNull();
            assertThat(request.drainEvents()).singleElement().satisfies(event -> {
                assertThat(event.eventType()).isEqualTo(MatchingRequest.EVENT_STATUS_CHANGED);
                assertThat(event.payload()).containsEntry("from", "PENDING").containsEntry("to", to.name());
            });
        } else {
            OffsetDateTime closedAt = request.getClosedAt();

            assertThatThrownBy(() -> apply(request, to)).isInstanceOf(InvalidTransitionException.class);

            assertThat(request.getStatus()).isEqualTo(from);
            assertThat(request.getClosedAt()).isEqualTo(closedAt);
            assertThat(request.pendingEvents()).isEmpty();
        }
    }

    @ParameterizedTest
    @EnumSource(MatchingRequestStatus.class)
    void everyStatusButPendingIsTerminal(MatchingRequestStatus status) {
        assertThat(status.isTerminal()).isEqualTo(status != MatchingRequestStatus.PENDING);
    }

    private static void apply(MatchingRequest request, MatchingRequestStatus target) {
        switch (target) {
            case MATCHED -> request.matchWith(UUID.randomUUID(), null, NOW.plusHours(1));
            case CANCELLED -> request.cancel("changed plans", null, NOW.plusHours(1));
            case EXPIRED -> request.expire(AFTER_EXPIRY);
            default -> throw new IllegalArgumentException("No command reaches " + target);
        }
    }

    private static MatchingRequest requestIn(MatchingRequestStatus status) {
        MatchingRequest request = MatchingRequest.create(new NewMatchingRequest(UUID.randomUUID(),
                TutorSubject.CHEMISTRY, null, null, List.of(), null), TTL, null, NOW);
        if (status != MatchingRequestStatus.PENDING) {
            apply(request, status);
        }
        request.drainEvents();
        return request;
    }
}
