package com.tutorhub.backend.modules.tutor.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.global.error.ProblemException;
import com.tutorhub.backend.modules.tutor.application.TutorService.TierReport;
import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.NewTutor;
import com.tutorhub.backend.modules.tutor.domain.SessionOutcome;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorStatus;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;
import com.tutorhub.backend.modules.tutor.infrastructure.memory.InMemoryTutorRepository;
import com.tutorhub.backend.modules.user.domain.NewUser;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserRole;
import com.tutorhub.backend.modules.user.domain.rules.TutorTier;
import com.tutorhub.backend.modules.user.domain.rules.UserBusinessRules;
import com.tutorhub.backend.modules.user.domain.rules.UserPolicy;
import com.tutorhub.backend.modules.user.infrastructure.memory.InMemoryUserRepository;
import com.tutorhub.backend.support.RecordingEventSink;
import com.tutorhub.backend.support.TestEventPublishers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TutorServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final UUID ADMIN = UUID.fromString("00000000-0000-0000-0000-0000000000ad");

    private InMemoryUserRepository userRepository;
    private InMemoryTutorRepository tutorRepository;
    private RecordingEventSink sink;
    private TutorService tutorService;

    @BeforeEach
    void setUp() {
        userRepository = new InMemoryUserRepository();
        tutorRepository = new InMemoryTutorRepository();
        sink = new RecordingEventSink();
        tutorService = new TutorService(
                tutorRepository,
                userRepository,
                new UserBusinessRules(UserPolicy.defaults()),
                TestEventPublishers.failing(sink),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
    }

    @Test
    void createTutorForTutorRoleUser() {
        User owner = storedUser("tina@example.com", UserRole.TUTOR);

        Tutor tutor = tutorService.createTutor(newTutor(owner.getId()), ADMIN);

        assertThat(tutorService.getTutorByUserId(owner.getId()).getId()).isEqualTo(tutor.getId());
        assertThat(sink.publishedTypes()).containsExactly(Tutor.EVENT_CREATED);
    }

    @Test
    void createTutorValidatesBeforeLookingUpTheOwner() {
        NewTutor invalid = new NewTutor(UUID.randomUUID(), "", EnumSet.of(TutorSubject.MATHEMATICS),
                ExperienceLevel.BEGINNER, BigDecimal.TEN, null, List.of("English"), "BSc");

        assertThatThrownBy(() -> tutorService.createTutor(invalid, ADMIN))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void createTutorRequiresExistingTutorRoleUser() {
        assertThatThrownBy(() -> tutorService.createTutor(newTutor(UUID.randomUUID()), ADMIN))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("USER_NOT_FOUND");

        User student = storedUser("sam@example.com", UserRole.STUDENT);
        assertThatThrownBy(() -> tutorService.createTutor(newTutor(student.getId()), ADMIN))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("USER_NOT_TUTOR");
    }

    @Test
    void secondProfileForSameUserConflicts() {
        User owner = storedUser("tina@example.com", UserRole.TUTOR);
        tutorService.createTutor(newTutor(owner.getId()), ADMIN);

        assertThatThrownBy(() -> tutorService.createTutor(newTutor(owner.getId()), ADMIN))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void sessionsCanOnlyBeRecordedForActiveTutors() {
        User owner = storedUser("tina@example.com", UserRole.TUTOR);
        Tutor tutor = tutorService.createTutor(newTutor(owner.getId()), ADMIN);

        assertThatThrownBy(() -> tutorService.recordSession(tutor.getId(), SessionOutcome.COMPLETED, ADMIN))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("TUTOR_NOT_ACTIVE");

        tutorService.changeStatus(tutor.getId(), TutorStatus.ACTIVE, null, ADMIN);
        Tutor updated = tutorService.recordSession(tutor.getId(), SessionOutcome.COMPLETED, ADMIN);
        assertThat(updated.getCompletedSessions()).isEqualTo(1);
    }

    @Test
    void tierReflectsSessionsRatingAndCancellations() {
        User owner = storedUser("tina@example.com", UserRole.TUTOR);
        Tutor tutor = tutorService.createTutor(newTutor(owner.getId()), ADMIN);
        tutorService.changeStatus(tutor.getId(), TutorStatus.ACTIVE, null, ADMIN);
        tutorService.updateRating(tutor.getId(), new BigDecimal("4.6"), 40, ADMIN);
        for (int i = 0; i < 50; i++) {
            tutorService.recordSession(tutor.getId(), SessionOutcome.COMPLETED, ADMIN);
        }

        TierReport report = tutorService.getTier(tutor.getId());

        assertThat(report.reputationScore()).isEqualTo(92);
        assertThat(report.completedSessions()).isEqualTo(50);
        assertThat(report.tier()).isEqualTo(TutorTier.EXPERT);
    }

    @Test
    void missingTutorIsNotFound() {
        assertThatThrownBy(() -> tutorService.getTutor(UUID.randomUUID()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("TUTOR_NOT_FOUND");
        assertThatThrownBy(() -> tutorService.deleteTutor(UUID.randomUUID(), ADMIN))
                .isInstanceOf(ProblemException.class);
    }

    private User storedUser(String email, UserRole role) {
        User user = User.register(new NewUser(email, "Tina", "Turner", role, null, List.of()), ADMIN, NOW);
        user.drainEvents();
        userRepository.save(user);
        return user;
    }

    private static NewTutor newTutor(UUID userId) {
        return new NewTutor(
                userId,
                "Patient maths tutor",
                EnumSet.of(TutorSubject.MATHEMATICS, TutorSubject.PHYSICS),
                ExperienceLevel.EXPERT,
                new BigDecimal("35.50"),
                "usd",
                List.of("English"),
                "PhD Physics"
        );
    }
}
