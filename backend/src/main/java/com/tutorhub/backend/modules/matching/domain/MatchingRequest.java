package com.tutorhub.backend.modules.matching.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ChangeSet;
import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.EventSource;
import com.tutorhub.backend.global.domain.InvalidStateException;
import com.tutorhub.backend.global.domain.PendingEvents;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.global.domain.Violations;
import com.tutorhub.backend.global.jpa.AbstractTimestampedEntity;
import com.tutorhub.backend.global.jpa.StringListConverter;
import com.tutorhub.backend.modules.tutor.domain.ExperienceLevel;
import com.tutorhub.backend.modules.tutor.domain.TutorSubject;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

/**
 * 학생의 튜터 매칭 요청. PENDING 상태는 매칭, 취소, 만료 중 한 번만 벗어난다.
 */
@Entity
@Table(name = "matching_requests")
public class MatchingRequest extends AbstractTimestampedEntity implements EventSource {

    public static final String AGGREGATE_TYPE = "matching_request";
    public static final String EVENT_CREATED = "matching_request.created";
    public static final String EVENT_UPDATED = "matching_request.updated";
    public static final String EVENT_STATUS_CHANGED = "matching_request.status_changed";

    static final int MAX_DESCRIPTION_LENGTH = 1000;
    static final int MAX_REASON_LENGTH = 500;
    static final int MAX_LANGUAGES = 20;
    static final int MAX_LANGUAGE_LENGTH = 50;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subject", nullable = false, length = 30)
    private TutorSubject subject;

    @Enumerated(EnumType.STRING)
    @Column(name = "preferred_experience_level", length = 20)
    private ExperienceLevel preferredExperienceLevel;

    @Column(name = "max_hourly_rate", precision = 10, scale = 2)
    private BigDecimal maxHourlyRate;

    @Convert(converter = StringListConverter.class)
    @Column(name = "preferred_languages", nullable = false, length = 1000)
    private List<String> preferredLanguages = new ArrayList<>();

    @Column(name = "description", length = MAX_DESCRIPTION_LENGTH)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private MatchingRequestStatus status;

    @Column(name = "matched_tutor_id", columnDefinition = "uuid")
    private UUID matchedTutorId;

    @Column(name = "cancellation_reason", length = MAX_REASON_LENGTH)
    private String cancellationReason;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private OffsetDateTime requestedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Transient
    private PendingEvents events = new PendingEvents();

    protected MatchingRequest() {
    }

    public static MatchingRequest create(NewMatchingRequest props, Duration ttl, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        violations.requireNonNull("studentId", props.studentId());
        violations.requireNonNull("subject", props.subject());
        violations.nonNegative("maxHourlyRate", props.maxHourlyRate());
        violations.textItems("preferredLanguages", props.preferredLanguages(), MAX_LANGUAGES, MAX_LANGUAGE_LENGTH);
        violations.optionalText("description", props.description(), MAX_DESCRIPTION_LENGTH);
        violations.throwIfAny();
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Request TTL must be positive");
        }

        MatchingRequest request = new MatchingRequest();
        request.id = UUID.randomUUID();
        request.studentId = props.studentId();
        request.subject = props.subject();
        request.preferredExperienceLevel = props.preferredExperienceLevel();
        request.maxHourlyRate = money(props.maxHourlyRate());
        request.preferredLanguages = trimAll(props.preferredLanguages());
        request.description = normalizeOptional(props.description());
        request.status = MatchingRequestStatus.PENDING;
        request.requestedAt = now;
        request.expiresAt = now.plus(ttl);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("studentId", request.studentId.toString());
        payload.put("subject", request.subject.name());
        payload.put("expiresAt", request.expiresAt.toString());
        request.raise(EVENT_CREATED, actorId, now, payload);
        return request;
    }

    /**
     * @return {@code false} when nothing changed
     * @throws InvalidStateException when the request is no longer pending
     */
    public boolean update(MatchingRequestChanges changes, UUID actorId, OffsetDateTime now) {
        requirePending("update");
        Violations violations = new Violations();
        violations.nonNegative("maxHourlyRate", changes.maxHourlyRate());
        violations.textItems("preferredLanguages", changes.preferredLanguages(), MAX_LANGUAGES, MAX_LANGUAGE_LENGTH);
        violations.optionalText("description", changes.description(), MAX_DESCRIPTION_LENGTH);
        violations.throwIfAny();

        ChangeSet changeSet = new ChangeSet();
        if (changes.subject() != null && changes.subject() != subject) {
            subject = changes.subject();
            changeSet.record("subject", subject.name());
        }
        if (changes.preferredExperienceLevel() != null && changes.preferredExperienceLevel() != preferredExperienceLevel) {
            preferredExperienceLevel = changes.preferredExperienceLevel();
            changeSet.record("preferredExperienceLevel", preferredExperienceLevel.name());
        }
        if (changes.maxHourlyRate() != null) {
            BigDecimal proposed = money(changes.maxHourlyRate());
            if (maxHourlyRate == null || proposed.compareTo(maxHourlyRate) != 0) {
                maxHourlyRate = proposed;
                changeSet.record("maxHourlyRate", proposed);
            }
        }
        changeSet.apply("preferredLanguages", preferredLanguages,
                changes.preferredLanguages() == null ? null : trimAll(changes.preferredLanguages()),
                value -> this.preferredLanguages = value);
        if (changes.description() != null) {
            String proposed = normalizeOptional(changes.description());
            if (!Objects.equals(description, proposed)) {
                description = proposed;
                changeSet.record("description", proposed);
            }
        }

        if (changeSet.isEmpty()) {
            return false;
        }
        raise(EVENT_UPDATED, actorId, now, changeSet.toPayload(actorId));
        return true;
    }

    public void matchWith(UUID tutorId, UUID actorId, OffsetDateTime now) {
        if (tutorId == null) {
            throw ValidationException.of("tutorId", "required", "must be provided");
        }
        if (status == MatchingRequestStatus.PENDING && isOverdue(now)) {
            throw new InvalidStateException(AGGREGATE_TYPE, "Request " + id + " expired at " + expiresAt);
        }
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("tutorId", tutorId.toString());
        changeStatus(MatchingRequestStatus.MATCHED, actorId, now, extra);
        matchedTutorId = tutorId;
    }

    public void cancel(String reason, UUID actorId, OffsetDateTime now) {
        new Violations().optionalText("reason", reason, MAX_REASON_LENGTH).throwIfAny();
        String normalized = normalizeOptional(reason);
        Map<String, Object> extra = new LinkedHashMap<>();
        if (normalized != null) {
            extra.put("reason", normalized);
        }
        changeStatus(MatchingRequestStatus.CANCELLED, actorId, now, extra);
        cancellationReason = normalized;
    }

    /**
     * @throws InvalidStateException when {@code now} is not yet past {@link #getExpiresAt()}
     */
    public void expire(OffsetDateTime now) {
        if (status == MatchingRequestStatus.PENDING && !isOverdue(now)) {
            throw new InvalidStateException(AGGREGATE_TYPE, "Request " + id + " does not expire before " + expiresAt);
        }
        changeStatus(MatchingRequestStatus.EXPIRED, null, now, Map.of());
    }

    public boolean isOverdue(OffsetDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isPending() {
        return status == MatchingRequestStatus.PENDING;
    }

    @Override
    public List<DomainEvent> pendingEvents() {
        return events.view();
    }

    @Override
    public List<DomainEvent> drainEvents() {
        return events.drain();
    }

    private void changeStatus(
            MatchingRequestStatus target,
            UUID actorId,
            OffsetDateTime now,
            Map<String, Object> extra
    ) {
        MatchingRequestStatus.TRANSITIONS.require(status, target);
        MatchingRequestStatus from = status;
        status = target;
        closedAt = now;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.name());
        payload.put("to", target.name());
        payload.putAll(extra);
        raise(EVENT_STATUS_CHANGED, actorId, now, payload);
    }

    private void requirePending(String operation) {
        if (status != MatchingRequestStatus.PENDING) {
            throw new InvalidStateException(AGGREGATE_TYPE,
                    "Cannot " + operation + " request " + id + " in status " + status);
        }
    }

    private void raise(String eventType, UUID actorId, OffsetDateTime now, Map<String, Object> payload) {
        events.append(DomainEvent.of(eventType, AGGREGATE_TYPE, id, actorId, now, payload));
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static String normalizeOptional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static List<String> trimAll(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values.stream().map(String::trim).toList());
    }

    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public TutorSubject getSubject() {
        return subject;
    }

    public ExperienceLevel getPreferredExperienceLevel() {
        return preferredExperienceLevel;
    }

    public BigDecimal getMaxHourlyRate() {
        return maxHourlyRate;
    }

    public List<String> getPreferredLanguages() {
        return List.copyOf(preferredLanguages);
    }

    public String getDescription() {
        return description;
    }

    public MatchingRequestStatus getStatus() {
        return status;
    }

    public UUID getMatchedTutorId() {
        return matchedTutorId;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public OffsetDateTime getRequestedAt() {
        return requestedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }
}
