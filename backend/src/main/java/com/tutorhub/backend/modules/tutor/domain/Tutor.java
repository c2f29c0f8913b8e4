package com.tutorhub.backend.modules.tutor.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import com.tutorhub.backend.global.domain.ChangeSet;
import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.EventSource;
import com.tutorhub.backend.global.domain.PendingEvents;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.global.domain.Violations;
import com.tutorhub.backend.global.jpa.AbstractTimestampedEntity;
import com.tutorhub.backend.global.jpa.StringListConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

@Entity
@Table(name = "tutors")
public class Tutor extends AbstractTimestampedEntity implements EventSource {

    public static final String AGGREGATE_TYPE = "tutor";
    public static final String EVENT_CREATED = "tutor.created";
    public static final String EVENT_PROFILE_UPDATED = "tutor.profile_updated";
    public static final String EVENT_STATUS_CHANGED = "tutor.status_changed";
    public static final String EVENT_RATING_UPDATED = "tutor.rating_updated";
    public static final String EVENT_SESSION_RECORDED = "tutor.session_recorded";

    public static final String DEFAULT_CURRENCY = "USD";
    static final int MAX_BIO_LENGTH = 1000;
    static final int MAX_EDUCATION_LENGTH = 500;
    static final int MAX_LANGUAGES = 20;
    static final int MAX_LANGUAGE_LENGTH = 50;
    static final BigDecimal MAX_RATING = new BigDecimal("5.00");
    private static final Pattern CURRENCY_PATTERN = Pattern.compile("^[A-Z]{3}$");

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, unique = true, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "bio", nullable = false, length = MAX_BIO_LENGTH)
    private String bio;

    @Convert(converter = TutorSubjectsConverter.class)
    @Column(name = "subjects", nullable = false, length = 255)
    private Set<TutorSubject> subjects = EnumSet.noneOf(TutorSubject.class);

    @Enumerated(EnumType.STRING)
    @Column(name = "experience_level", nullable = false, length = 20)
    private ExperienceLevel experienceLevel;

    @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Convert(converter = StringListConverter.class)
    @Column(name = "languages", nullable = false, length = 1000)
    private List<String> languages = new ArrayList<>();

    @Column(name = "education", nullable = false, length = MAX_EDUCATION_LENGTH)
    private String education;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private TutorStatus status;

    @Column(name = "rating", nullable = false, precision = 3, scale = 2)
    private BigDecimal rating;

    @Column(name = "total_reviews", nullable = false)
    private int totalReviews;

    @Column(name = "completed_sessions", nullable = false)
    private int completedSessions;

    @Column(name = "cancelled_sessions", nullable = false)
    private int cancelledSessions;

    @Transient
    private PendingEvents events = new PendingEvents();

    protected Tutor() {
    }

    public static Tutor create(NewTutor props, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        violations.requireNonNull("userId", props.userId());
        violations.requireText("bio", props.bio(), MAX_BIO_LENGTH);
        requireSubjects(violations, props.subjects(), true);
        violations.requireNonNull("experienceLevel", props.experienceLevel());
        violations.requireNonNull("hourlyRate", props.hourlyRate());
        violations.nonNegative("hourlyRate", props.hourlyRate());
        validateCurrency(violations, props.currency());
        requireLanguages(violations, props.languages(), true);
        violations.requireText("education", props.education(), MAX_EDUCATION_LENGTH);
        violations.throwIfAny();

        Tutor tutor = new Tutor();
        tutor.id = UUID.randomUUID();
        tutor.userId = props.userId();
        tutor.bio = props.bio().trim();
        tutor.subjects = EnumSet.copyOf(props.subjects());
        tutor.experienceLevel = props.experienceLevel();
        tutor.hourlyRate = money(props.hourlyRate());
        tutor.currency = props.currency() == null ? DEFAULT_CURRENCY : normalizeCurrency(props.currency());
        tutor.languages = trimAll(props.languages());
        tutor.education = props.education().trim();
        tutor.status = TutorStatus.PENDING_APPROVAL;
        tutor.rating = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        tutor.totalReviews = 0;
        tutor.completedSessions = 0;
        tutor.cancelledSessions = 0;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", tutor.userId.toString());
        payload.put("subjects", subjectNames(tutor.subjects));
        payload.put("experienceLevel", tutor.experienceLevel.name());
        payload.put("status", tutor.status.name());
        tutor.raise(EVENT_CREATED, actorId, now, payload);
        return tutor;
    }

    /**
     * @return {@code false} when no provided field differs; no event is queued then
     */
    public boolean updateProfile(TutorChanges changes, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        if (changes.bio() != null) {
            violations.requireText("bio", changes.bio(), MAX_BIO_LENGTH);
        }
        requireSubjects(violations, changes.subjects(), false);
        violations.nonNegative("hourlyRate", changes.hourlyRate());
        validateCurrency(violations, changes.currency());
        requireLanguages(violations, changes.languages(), false);
        if (changes.education() != null) {
            violations.requireText("education", changes.education(), MAX_EDUCATION_LENGTH);
        }
        violations.throwIfAny();

        ChangeSet changeSet = new ChangeSet();
        changeSet.apply("bio", bio, trimOrNull(changes.bio()), value -> this.bio = value);
        if (changes.subjects() != null) {
            EnumSet<TutorSubject> proposed = EnumSet.copyOf(changes.subjects());
            if (!proposed.equals(subjects)) {
                subjects = proposed;
                changeSet.record("subjects", subjectNames(proposed));
            }
        }
        if (changes.experienceLevel() != null && changes.experienceLevel() != experienceLevel) {
            experienceLevel = changes.experienceLevel();
            changeSet.record("experienceLevel", experienceLevel.name());
        }
        if (changes.hourlyRate() != null) {
            BigDecimal proposed = money(changes.hourlyRate());
            if (proposed.compareTo(hourlyRate) != 0) {
                hourlyRate = proposed;
                changeSet.record("hourlyRate", proposed);
            }
        }
        changeSet.apply("currency", currency, changes.currency() == null ? null : normalizeCurrency(changes.currency()),
                value -> this.currency = value);
        changeSet.apply("languages", languages, changes.languages() == null ? null : trimAll(changes.languages()),
                value -> this.languages = value);
        changeSet.apply("education", education, trimOrNull(changes.education()), value -> this.education = value);

        if (changeSet.isEmpty()) {
            return false;
        }
        raise(EVENT_PROFILE_UPDATED, actorId, now, changeSet.toPayload(actorId));
        return true;
    }

    /**
     * @throws com.tutorhub.backend.global.domain.InvalidTransitionException when the edge is not in the graph
     */
    public void transition(TutorStatus target, UUID actorId, String reason, OffsetDateTime now) {
        TutorStatus.TRANSITIONS.require(status, target);
        TutorStatus from = status;
        status = target;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.name());
        payload.put("to", target.name());
        if (reason != null && !reason.isBlank()) {
            payload.put("reason", reason.trim());
        }
        raise(EVENT_STATUS_CHANGED, actorId, now, payload);
    }

    public void approve(UUID actorId, OffsetDateTime now) {
        transition(TutorStatus.ACTIVE, actorId, null, now);
    }

    public void suspend(UUID actorId, String reason, OffsetDateTime now) {
        transition(TutorStatus.SUSPENDED, actorId, reason, now);
    }

    public void updateRating(BigDecimal newRating, int newTotalReviews, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        violations.requireNonNull("rating", newRating);
        if (newRating != null && (newRating.signum() < 0 || newRating.compareTo(MAX_RATING) > 0)) {
            violations.add("rating", "out_of_range", "must be between 0 and 5");
        }
        if (newTotalReviews < 0) {
            violations.add("totalReviews", "negative", "must be zero or greater");
        }
        violations.throwIfAny();

        BigDecimal previous = rating;
        rating = newRating.setScale(2, RoundingMode.HALF_UP);
        totalReviews = newTotalReviews;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previousRating", previous);
        payload.put("rating", rating);
        payload.put("totalReviews", totalReviews);
        raise(EVENT_RATING_UPDATED, actorId, now, payload);
    }

    public void recordSession(SessionOutcome outcome, UUID actorId, OffsetDateTime now) {
        if (outcome == null) {
            throw ValidationException.of("outcome", "required", "must be provided");
        }
        if (outcome == SessionOutcome.COMPLETED) {
            completedSessions++;
        } else {
            cancelledSessions++;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("outcome", outcome.name());
        payload.put("completedSessions", completedSessions);
        payload.put("cancelledSessions", cancelledSessions);
        raise(EVENT_SESSION_RECORDED, actorId, now, payload);
    }

    /**
     * Share of cancelled sessions among all recorded ones; 0 when none were recorded.
     */
    public double cancellationRate() {
        int total = completedSessions + cancelledSessions;
        return total == 0 ? 0.0 : (double) cancelledSessions / total;
    }

    /**
     * Rating mapped onto a 0-100 reputation scale.
     */
    public int reputationScore() {
        return rating.multiply(BigDecimal.valueOf(20)).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    public boolean isActive() {
        return status == TutorStatus.ACTIVE;
    }

    public boolean teaches(TutorSubject subject) {
        return subjects.contains(subject);
    }

    @Override
    public List<DomainEvent> pendingEvents() {
        return events.view();
    }

    @Override
    public List<DomainEvent> drainEvents() {
        return events.drain();
    }

    private void raise(String eventType, UUID actorId, OffsetDateTime now, Map<String, Object> payload) {
        events.append(DomainEvent.of(eventType, AGGREGATE_TYPE, id, actorId, now, payload));
    }

    private static void requireSubjects(Violations violations, Set<TutorSubject> subjects, boolean required) {
        if (subjects == null) {
            if (required) {
                violations.add("subjects", "required", "at least one subject is required");
            }
            return;
        }
        if (subjects.isEmpty() || subjects.stream().anyMatch(Objects::isNull)) {
            violations.add("subjects", "required", "at least one subject is required");
        }
    }

    private static void requireLanguages(Violations violations, List<String> languages, boolean required) {
        if (languages == null) {
            if (required) {
                violations.add("languages", "required", "at least one language is required");
            }
            return;
        }
        if (languages.isEmpty()) {
            violations.add("languages", "required", "at least one language is required");
            return;
        }
        violations.textItems("languages", languages, MAX_LANGUAGES, MAX_LANGUAGE_LENGTH);
    }

    private static void validateCurrency(Violations violations, String currency) {
        if (currency != null && !CURRENCY_PATTERN.matcher(normalizeCurrency(currency)).matches()) {
            violations.add("currency", "invalid_format", "must be a 3-letter ISO-4217 code");
        }
    }

    private static String normalizeCurrency(String currency) {
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }

    private static List<String> trimAll(List<String> values) {
        return new ArrayList<>(values.stream().map(String::trim).toList());
    }

    private static List<String> subjectNames(Set<TutorSubject> subjects) {
        return subjects.stream().map(Enum::name).toList();
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getBio() {
        return bio;
    }

    public Set<TutorSubject> getSubjects() {
        return EnumSet.copyOf(subjects);
    }

    public ExperienceLevel getExperienceLevel() {
        return experienceLevel;
    }

    public BigDecimal getHourlyRate() {
        return hourlyRate;
    }

    public String getCurrency() {
        return currency;
    }

    public List<String> getLanguages() {
        return List.copyOf(languages);
    }

    public String getEducation() {
        return education;
    }

    public TutorStatus getStatus() {
        return status;
    }

    public BigDecimal getRating() {
        return rating;
    }

    public int getTotalReviews() {
        return totalReviews;
    }

    public int getCompletedSessions() {
        return completedSessions;
    }

    public int getCancelledSessions() {
        return cancelledSessions;
    }
}
