package com.tutorhub.backend.modules.matching.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.error.ProblemException;
import com.tutorhub.backend.modules.event.application.DomainEventPublisher;
import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestChanges;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestRepository;
import com.tutorhub.backend.modules.matching.domain.NewMatchingRequest;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorRepository;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MatchingRequestService {

    private static final Logger log = LoggerFactory.getLogger(MatchingRequestService.class);

    private final MatchingRequestRepository matchingRequestRepository;
    private final UserRepository userRepository;
    private final TutorRepository tutorRepository;
    private final DomainEventPublisher eventPublisher;
    private final MatchingProperties properties;
    private final Clock clock;

    public MatchingRequestService(
            MatchingRequestRepository matchingRequestRepository,
            UserRepository userRepository,
            TutorRepository tutorRepository,
            DomainEventPublisher eventPublisher,
            MatchingProperties properties,
            Clock clock
    ) {
        this.matchingRequestRepository = matchingRequestRepository;
        this.userRepository = userRepository;
        this.tutorRepository = tutorRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public MatchingRequest createRequest(NewMatchingRequest props, UUID actorId) {
        MatchingRequest request = MatchingRequest.create(props, properties.requestTtl(), actorId, now());
        User student = userRepository.findById(props.studentId())
                .orElseThrow(() -> ProblemException.notFound("STUDENT_NOT_FOUND", props.studentId()));
        if (!student.getStatus().isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "STUDENT_NOT_ACTIVE",
                    "Student " + student.getId() + " is " + student.getStatus());
        }
        commit(request);
        log.info("Matching request opened requestId={} studentId={} subject={}",
                request.getId(), request.getStudentId(), request.getSubject());
        return request;
    }

    @Transactional(readOnly = true)
    public MatchingRequest getRequest(UUID requestId) {
        return matchingRequestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("MATCHING_REQUEST_NOT_FOUND", requestId));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PageResult<MatchingRequest> listRequests(int offset, int limit) {
        return matchingRequestRepository.findAll(offset, limit);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PageResult<MatchingRequest> listByStudent(UUID studentId, int offset, int limit) {
        return matchingRequestRepository.findByStudentId(studentId, offset, limit);
    }

    public MatchingRequest updateRequest(UUID requestId, MatchingRequestChanges changes, UUID actorId) {
        MatchingRequest request = getRequest(requestId);
        if (request.update(changes, actorId, now())) {
            commit(request);
        }
        return request;
    }

    /**
     * Assigns an active tutor who teaches the requested subject within the student's rate ceiling.
     */
    public MatchingRequest matchWithTutor(UUID requestId, UUID tutorId, UUID actorId) {
        MatchingRequest request = getRequest(requestId);
        Tutor tutor = tutorRepository.findById(tutorId)
                .orElseThrow(() -> ProblemException.notFound("TUTOR_NOT_FOUND", tutorId));
        if (!tutor.isActive()) {
            throw new ProblemException(HttpStatus.CONFLICT, "TUTOR_NOT_ACTIVE",
                    "Tutor " + tutorId + " is " + tutor.getStatus());
        }
        if (!tutor.teaches(request.getSubject())) {
            throw new ProblemException(HttpStatus.CONFLICT, "TUTOR_SUBJECT_MISMATCH",
                    "Tutor " + tutorId + " does not teach " + request.getSubject());
        }
        if (request.getMaxHourlyRate() != null && tutor.getHourlyRate().compareTo(request.getMaxHourlyRate()) > 0) {
            throw new ProblemException(HttpStatus.CONFLICT, "TUTOR_RATE_TOO_HIGH",
                    "Tutor rate " + tutor.getHourlyRate() + " exceeds " + request.getMaxHourlyRate());
        }
        request.matchWith(tutorId, actorId, now());
        commit(request);
        log.info("Matching request matched requestId={} tutorId={}", requestId, tutorId);
        return request;
    }

    public MatchingRequest cancelRequest(UUID requestId, String reason, UUID actorId) {
        MatchingRequest request = getRequest(requestId);
        request.cancel(reason, actorId, now());
        commit(request);
        return request;
    }

    /**
     * @return number of requests moved to EXPIRED in this sweep
     */
    public int expireOverdueRequests() {
        OffsetDateTime now = now();
        List<MatchingRequest> overdue = matchingRequestRepository.findExpirable(now, properties.expiryBatchSize());
        for (MatchingRequest request : overdue) {
            request.expire(now);
            commit(request);
        }
        if (!overdue.isEmpty()) {
            log.info("Expired {} overdue matching requests", overdue.size());
        }
        return overdue.size();
    }

    private void commit(MatchingRequest request) {
        matchingRequestRepository.save(request);
        eventPublisher.publishPending(request);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
