package com.tutorhub.backend.modules.tutor.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.global.error.ProblemException;
import com.tutorhub.backend.modules.event.application.DomainEventPublisher;
import com.tutorhub.backend.modules.tutor.domain.NewTutor;
import com.tutorhub.backend.modules.tutor.domain.SessionOutcome;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorChanges;
import com.tutorhub.backend.modules.tutor.domain.TutorRepository;
import com.tutorhub.backend.modules.tutor.domain.TutorStatus;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserRepository;
import com.tutorhub.backend.modules.user.domain.rules.TutorTier;
import com.tutorhub.backend.modules.user.domain.rules.UserBusinessRules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TutorService {

    private static final Logger log = LoggerFactory.getLogger(TutorService.class);

    private final TutorRepository tutorRepository;
    private final UserRepository userRepository;
    private final UserBusinessRules businessRules;
    private final DomainEventPublisher eventPublisher;
    private final Clock clock;

    public TutorService(
            TutorRepository tutorRepository,
            UserRepository userRepository,
            UserBusinessRules businessRules,
            DomainEventPublisher eventPublisher,
            Clock clock
    ) {
        this.tutorRepository = tutorRepository;
        this.userRepository = userRepository;
        this.businessRules = businessRules;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Tutor createTutor(NewTutor props, UUID actorId) {
        Tutor tutor = Tutor.create(props, actorId, now());
        User user = userRepository.findById(props.userId())
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", props.userId()));
        if (!user.getRole().canTeach()) {
            throw new ProblemException(HttpStatus.CONFLICT, "USER_NOT_TUTOR",
                    "User " + user.getId() + " must hold the TUTOR role to own a tutor profile");
        }
        if (tutorRepository.existsByUserId(props.userId())) {
            throw new ConflictException("userId", "user already has a tutor profile: " + props.userId());
        }
        commit(tutor);
        log.info("Tutor profile created tutorId={} userId={}", tutor.getId(), tutor.getUserId());
        return tutor;
    }

    @Transactional(readOnly = true)
    public Tutor getTutor(UUID tutorId) {
        return tutorRepository.findById(tutorId)
                .orElseThrow(() -> ProblemException.notFound("TUTOR_NOT_FOUND", tutorId));
    }

    @Transactional(readOnly = true)
    public Tutor getTutorByUserId(UUID userId) {
        return tutorRepository.findByUserId(userId)
                .orElseThrow(() -> ProblemException.notFound("TUTOR_NOT_FOUND", userId));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PageResult<Tutor> listTutors(int offset, int limit) {
        return tutorRepository.findAll(offset, limit);
    }

    public Tutor updateProfile(UUID tutorId, TutorChanges changes, UUID actorId) {
        Tutor tutor = getTutor(tutorId);
        if (tutor.updateProfile(changes, actorId, now())) {
            commit(tutor);
        }
        return tutor;
    }

    public Tutor changeStatus(UUID tutorId, TutorStatus target, String reason, UUID actorId) {
        if (target == null) {
            throw ValidationException.of("status", "required", "must be provided");
        }
        Tutor tutor = getTutor(tutorId);
        TutorStatus from = tutor.getStatus();
        tutor.transition(target, actorId, reason, now());
        commit(tutor);
        log.info("Tutor status changed tutorId={} {} -> {}", tutorId, from, target);
        return tutor;
    }

    public Tutor updateRating(UUID tutorId, BigDecimal rating, int totalReviews, UUID actorId) {
        Tutor tutor = getTutor(tutorId);
        tutor.updateRating(rating, totalReviews, actorId, now());
        commit(tutor);
        return tutor;
    }

    public Tutor recordSession(UUID tutorId, SessionOutcome outcome, UUID actorId) {
        Tutor tutor = getTutor(tutorId);
        if (!tutor.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "TUTOR_NOT_ACTIVE",
                    "Sessions can be recorded only for active tutors");
        }
        tutor.recordSession(outcome, actorId, now());
        commit(tutor);
        return tutor;
    }

    @Transactional(readOnly = true)
    public TierReport getTier(UUID tutorId) {
        Tutor tutor = getTutor(tutorId);
        int reputationScore = tutor.reputationScore();
        double cancellationRate = tutor.cancellationRate();
        TutorTier tier = businessRules.tutorTier(tutor.getCompletedSessions(), reputationScore, cancellationRate);
        return new TierReport(tutorId, tier, tutor.getCompletedSessions(), reputationScore, cancellationRate);
    }

    public void deleteTutor(UUID tutorId, UUID actorId) {
        if (!tutorRepository.delete(tutorId)) {
            throw ProblemException.notFound("TUTOR_NOT_FOUND", tutorId);
        }
        log.warn("Tutor profile deleted tutorId={} actorId={}", tutorId, actorId);
    }

    private void commit(Tutor tutor) {
        tutorRepository.save(tutor);
        eventPublisher.publishPending(tutor);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public record TierReport(
            UUID tutorId,
            TutorTier tier,
            int completedSessions,
            int reputationScore,
            double cancellationRate
    ) {
    }
}
