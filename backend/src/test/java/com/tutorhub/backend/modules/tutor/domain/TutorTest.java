package com.tutorhub.backend.modules.tutor.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.InvalidTransitionException;
import com.tutorhub.backend.global.domain.ValidationException;

import org.junit.jupiter.api.Test;

class TutorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final UUID ACTOR = UUID.fromString("00000000-0000-0000-0000-0000000000aa");

    @Test
    void createDefaultsCurrencyAndStartsPendingApproval() {
        Tutor tutor = Tutor.create(newTutor(null), ACTOR, NOW);

        assertThat(tutor.getCurrency()).isEqualTo(Tutor.DEFAULT_CURRENCY);
        assertThat(tutor.getStatus()).isEqualTo(TutorStatus.PENDING_APPROVAL);
        assertThat(tutor.getHourlyRate()).isEqualByComparingTo("40.00");
        assertThat(tutor.getHourlyRate().scale()).isEqualTo(2);
        assertThat(tutor.drainEvents()).extracting(DomainEvent::eventType).containsExactly(Tutor.EVENT_CREATED);
    }

    @Test
    void createReportsAllViolations() {
        NewTutor invalid = new NewTutor(null, " ", Set.of(), null, new BigDecimal("-1"), "dollars", List.of(), "");

        assertThatThrownBy(() -> Tutor.create(invalid, ACTOR, NOW))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getFields()).containsExactlyInAnyOrder(
                        "userId", "bio", "subjects", "experienceLevel", "hourlyRate", "currency", "languages",
                        "education"));
    }

    @Test
    void profileUpdateQueuesSingleEventForChangedFields() {
        Tutor tutor = Tutor.create(newTutor("eur"), ACTOR, NOW);
        tutor.drainEvents();

        boolean changed = tutor.updateProfile(new TutorChanges(null, EnumSet.of(TutorSubject.PHYSICS), null,
                new BigDecimal("40"), "EUR", null, null), ACTOR, NOW);

        assertThat(changed).isTrue();
        List<DomainEvent> events = tutor.drainEvents();
        assertThat(events).hasSize(1);
        assertThat(events.get(0).payload().get("changedFields")).isEqualTo(List.of("subjects"));
        assertThat(tutor.teaches(TutorSubject.PHYSICS)).isTrue();
        assertThat(tutor.teaches(TutorSubject.MATHEMATICS)).isFalse();
    }

    @Test
    void approvingAnActiveTutorIsAnInvalidTransition() {
        Tutor tutor = Tutor.create(newTutor(null), ACTOR, NOW);
        tutor.approve(ACTOR, NOW);

        assertThatThrownBy(() -> tutor.approve(ACTOR, NOW)).isInstanceOf(InvalidTransitionException.class);
        assertThat(tutor.isActive()).isTrue();
    }

    @Test
    void ratingDrivesReputationScore() {
        Tutor tutor = Tutor.create(newTutor(null), ACTOR, NOW);

        tutor.updateRating(new BigDecimal("4.5"), 12, ACTOR, NOW);

        assertThat(tutor.getRating()).isEqualByComparingTo("4.50");
        assertThat(tutor.getTotalReviews()).isEqualTo(12);
        assertThat(tutor.reputationScore()).isEqualTo(90);
        assertThatThrownBy(() -> tutor.updateRating(new BigDecimal("5.01"), 12, ACTOR, NOW))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void sessionsFeedCancellationRate() {
        Tutor tutor = Tutor.create(newTutor(null), ACTOR, NOW);
        assertThat(tutor.cancellationRate()).isZero();

        tutor.recordSession(SessionOutcome.COMPLETED, ACTOR, NOW);
        tutor.recordSession(SessionOutcome.COMPLETED, ACTOR, NOW);
        tutor.recordSession(SessionOutcome.COMPLETED, ACTOR, NOW);
        tutor.recordSession(SessionOutcome.CANCELLED, ACTOR, NOW);

        assertThat(tutor.getCompletedSessions()).isEqualTo(3);
        assertThat(tutor.getCancelledSessions()).isEqualTo(1);
        assertThat(tutor.cancellationRate()).isEqualTo(0.25);
    }

    @Test
    void immutableSubjectSetsAreAccepted() {
        NewTutor props = new NewTutor(UUID.randomUUID(), "Calculus", Set.of(TutorSubject.MATHEMATICS),
                ExperienceLevel.ADVANCED, new BigDecimal("40"), null, List.of("English"), "MSc Mathematics");

        Tutor tutor = Tutor.create(props, ACTOR, NOW);
        tutor.drainEvents();
        boolean changed = tutor.updateProfile(
                new TutorChanges(null, Set.of(TutorSubject.PHYSICS), null, null, null, null, null), ACTOR, NOW);

        assertThat(changed).isTrue();
        assertThat(tutor.getSubjects()).containsExactly(TutorSubject.PHYSICS);
    }

    @Test
    void subjectSetWithNullIsRejected() {
        Set<TutorSubject> withNull = new HashSet<>(Arrays.asList(TutorSubject.MATHEMATICS, null));
        NewTutor props = new NewTutor(UUID.randomUUID(), "Calculus", withNull,
                ExperienceLevel.ADVANCED, new BigDecimal("40"), null, List.of("English"), "MSc Mathematics");

        assertThatThrownBy(() -> Tutor.create(props, ACTOR, NOW))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getFields()).containsExactly("subjects"));
    }

    private static NewTutor newTutor(String currency) {
        return new NewTutor(
                UUID.randomUUID(),
                "Ten years of teaching calculus",
                EnumSet.of(TutorSubject.MATHEMATICS),
                ExperienceLevel.ADVANCED,
                new BigDecimal("40"),
                currency,
                List.of("English", "Korean"),
                "MSc Mathematics"
        );
    }
}
