package com.tutorhub.backend.modules;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestRepository;
import com.tutorhub.backend.modules.matching.domain.NewMatchingRequest;
import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.NewTutor;
import com.tutorhub.backend.modules.tutor.domain.SessionOutcome;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorRepository;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;
import com.tutorhub.backend.modules.user.domain.NewUser;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserChanges;
import com.tutorhub.backend.modules.user.domain.UserRepository;
import com.tutorhub.backend.modules.user.domain.UserRole;
import com.tutorhub.backend.modules.user.domain.UserStatus;
import com.tutorhub.backend.support.AbstractApiIntegrationTest;

import org.assertj.core.api.recursive.comparison.RecursiveComparisonConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Saves mutated aggregates through the JPA adapters on H2 and reloads them in a fresh persistence
 * context. Everything except the audit columns and the transient event buffer must survive.
 */
class JpaRepositoryRoundTripTest extends AbstractApiIntegrationTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 1, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TutorRepository tutorRepository;

    @Autowired
    private MatchingRequestRepository matchingRequestRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    void mutatedUserReloadsFieldForField() {
        User user = User.register(new NewUser(unique("round"), "Rita", "Round", UserRole.STUDENT, null,
                List.of("chess", "go")), null, T0);
        inTransaction(() -> userRepository.save(user));

        user.transition(UserStatus.ACTIVE, null, null, T0.plusMinutes(1));
        user.update(new UserChanges(unique("moved"), null, null, "Likes puzzles", List.of("chess")),
                null, T0.plusDays(1));
        user.changeRole(UserRole.TUTOR, null, T0.plusDays(2));
        user.recordLoginSuccess(T0.plusDays(3));
        user.recordLoginFailure(T0.plusDays(4));
        user.drainEvents();
        inTransaction(() -> userRepository.save(user));

        User reloaded = transactionTemplate.execute(status -> userRepository.findById(user.getId()).orElseThrow());

        assertThat(reloaded).usingRecursiveComparison(aggregateComparison()).isEqualTo(user);
        assertThat(reloaded.getEmailChangedAt()).isNotNull();
    }

    @Test
    void ratedTutorReloadsFieldForField() {
        User owner = User.register(new NewUser(unique("owner"), "Otto", "Owner", UserRole.TUTOR, null, null),
                null, T0);
        Tutor tutor = Tutor.create(new NewTutor(owner.getId(), "Organic chemistry",
                EnumSet.of(TutorSubject.CHEMISTRY, TutorSubject.BIOLOGY), ExperienceLevel.EXPERT,
                new BigDecimal("55.5"), "krw", List.of("Korean", "English"), "PhD Chemistry"), null, T0);
        tutor.approve(null, T0.plusHours(1));
        tutor.updateRating(new BigDecimal("4.6"), 12, null, T0.plusHours(2));
        tutor.recordSession(SessionOutcome.COMPLETED, null, T0.plusHours(3));
        tutor.recordSession(SessionOutcome.CANCELLED, null, T0.plusHours(4));
        tutor.suspend(null, "late twice", T0.plusHours(5));
        tutor.drainEvents();

        inTransaction(() -> {
            userRepository.save(owner);
            tutorRepository.save(tutor);
        });
        Tutor reloaded = transactionTemplate.execute(status ->
                tutorRepository.findByUserId(owner.getId()).orElseThrow());

        assertThat(reloaded).usingRecursiveComparison(aggregateComparison()).isEqualTo(tutor);
    }

    @Test
    void closedRequestsReloadFieldForField() {
        User student = User.register(new NewUser(unique("student"), "Stan", "Student", UserRole.STUDENT, null, null),
                null, T0);
        MatchingRequest matched = MatchingRequest.create(new NewMatchingRequest(student.getId(),
                TutorSubject.MATHEMATICS, ExperienceLevel.ADVANCED, new BigDecimal("60"), List.of("English"),
                "Olympiad prep"), Duration.ofDays(7), null, T0);
        matched.matchWith(UUID.randomUUID(), null, T0.plusDays(1));
        MatchingRequest cancelled = MatchingRequest.create(new NewMatchingRequest(student.getId(),
                TutorSubject.PHYSICS, null, null, List.of(), null), Duration.ofDays(7), null, T0);
        cancelled.cancel("found a study group", null, T0.plusDays(2));
        matched.drainEvents();
        cancelled.drainEvents();

        inTransaction(() -> {
            userRepository.save(student);
            matchingRequestRepository.save(matched);
            matchingRequestRepository.save(cancelled);
        });

        MatchingRequest reloadedMatched = transactionTemplate.execute(status ->
                matchingRequestRepository.findById(matched.getId()).orElseThrow());
        MatchingRequest reloadedCancelled = transactionTemplate.execute(status ->
                matchingRequestRepository.findById(cancelled.getId()).orElseThrow());

        assertThat(reloadedMatched).usingRecursiveComparison(aggregateComparison()).isEqualTo(matched);
        assertThat(reloadedCancelled).usingRecursiveComparison(aggregateComparison()).isEqualTo(cancelled);
        assertThat(reloadedMatched.getMatchedTutorId()).isNotNull();
        assertThat(reloadedCancelled.getCancellationReason()).isEqualTo("found a study group");
    }

    private void inTransaction(Runnable work) {
        transactionTemplate.executeWithoutResult(status -> work.run());
    }

    private static RecursiveComparisonConfiguration aggregateComparison() {
        return RecursiveComparisonConfiguration.builder()
                .withIgnoredFields("createdAt", "updatedAt", "events")
                .withComparatorForType(Comparator.comparing(OffsetDateTime::toInstant), OffsetDateTime.class)
                .withComparatorForType(BigDecimal::compareTo, BigDecimal.class)
                .build();
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID() + "@example.com";
    }
}
