package com.tutorhub.backend.modules.user.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

import com.tutorhub.backend.global.domain.ChangeSet;
import com.tutorhub.backend.global.domain.DomainEvent;
import com.tutorhub.backend.global.domain.Email;
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

/**
 * Platform account. Created through {@link #register} and changed only through the named
 * mutations below, each of which queues exactly one event.
 */
@Entity
@Table(name = "users")
public class User extends AbstractTimestampedEntity implements EventSource {

    public static final String AGGREGATE_TYPE = "user";
    public static final String EVENT_CREATED = "user.created";
    public static final String EVENT_UPDATED = "user.updated";
    public static final String EVENT_STATUS_CHANGED = "user.status_changed";
    public static final String EVENT_ROLE_CHANGED = "user.role_changed";
    public static final String EVENT_LOGIN_SUCCEEDED = "user.login_succeeded";
    public static final String EVENT_LOGIN_FAILED = "user.login_failed";

    static final int MAX_NAME_LENGTH = 50;
    static final int MAX_BIO_LENGTH = 500;
    static final int MAX_SKILLS = 10;
    static final int MAX_SKILL_LENGTH = 50;
    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}][\\p{L} '\\-]*$");

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = Email.MAX_LENGTH)
    private String email;

    @Column(name = "first_name", nullable = false, length = MAX_NAME_LENGTH)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = MAX_NAME_LENGTH)
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private UserStatus status;

    @Column(name = "bio", length = MAX_BIO_LENGTH)
    private String bio;

    @Convert(converter = StringListConverter.class)
    @Column(name = "skills", nullable = false, length = 1000)
    private List<String> skills = new ArrayList<>();

    @Column(name = "registered_at", nullable = false, updatable = false)
    private OffsetDateTime registeredAt;

    @Column(name = "email_changed_at")
    private OffsetDateTime emailChangedAt;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Transient
    private PendingEvents events = new PendingEvents();

    protected User() {
    }

    public static User register(NewUser props, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        Email email = violations.capture(() -> Email.of("email", props.email()));
        validateName(violations, "firstName", props.firstName(), true);
        validateName(violations, "lastName", props.lastName(), true);
        violations.optionalText("bio", props.bio(), MAX_BIO_LENGTH);
        violations.textItems("skills", props.skills(), MAX_SKILLS, MAX_SKILL_LENGTH);
        violations.throwIfAny();

        User user = new User();
        user.id = UUID.randomUUID();
        user.email = email.value();
        user.firstName = props.firstName().trim();
        user.lastName = props.lastName().trim();
        user.role = props.role() != null ? props.role() : UserRole.STUDENT;
        user.status = UserStatus.PENDING_VERIFICATION;
        user.bio = normalizeOptional(props.bio());
        user.skills = normalizeItems(props.skills());
        user.registeredAt = now;
        user.failedLoginAttempts = 0;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", user.email);
        payload.put("firstName", user.firstName);
        payload.put("lastName", user.lastName);
        payload.put("role", user.role.name());
        payload.put("status", user.status.name());
        user.raise(EVENT_CREATED, actorId, now, payload);
        return user;
    }

    /**
     * Applies the provided fields. All of them are validated before any is written.
     *
     * @return {@code false} when nothing differs from the current state; no event is queued then
     */
    public boolean update(UserChanges changes, UUID actorId, OffsetDateTime now) {
        Violations violations = new Violations();
        Email newEmail = changes.email() == null
                ? null
                : violations.capture(() -> Email.of("email", changes.email()));
        validateName(violations, "firstName", changes.firstName(), false);
        validateName(violations, "lastName", changes.lastName(), false);
        violations.optionalText("bio", changes.bio(), MAX_BIO_LENGTH);
        violations.textItems("skills", changes.skills(), MAX_SKILLS, MAX_SKILL_LENGTH);
        violations.throwIfAny();

        ChangeSet changeSet = new ChangeSet();
        changeSet.apply("email", email, newEmail == null ? null : newEmail.value(), value -> {
            this.email = value;
            this.emailChangedAt = now;
        });
        changeSet.apply("firstName", firstName, trimOrNull(changes.firstName()), value -> this.firstName = value);
        changeSet.apply("lastName", lastName, trimOrNull(changes.lastName()), value -> this.lastName = value);
        if (changes.bio() != null) {
            // blank clears the bio
            String proposedBio = normalizeOptional(changes.bio());
            if (!Objects.equals(bio, proposedBio)) {
                bio = proposedBio;
                changeSet.record("bio", proposedBio);
            }
        }
        changeSet.apply("skills", skills, changes.skills() == null ? null : normalizeItems(changes.skills()),
                value -> this.skills = value);

        if (changeSet.isEmpty()) {
            return false;
        }
        raise(EVENT_UPDATED, actorId, now, changeSet.toPayload(actorId));
        return true;
    }

    /**
     * @throws com.tutorhub.backend.global.domain.InvalidTransitionException when the edge is not in the graph
     */
    public void transition(UserStatus target, UUID actorId, String reason, OffsetDateTime now) {
        UserStatus.TRANSITIONS.require(status, target);
        UserStatus from = status;
        status = target;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.name());
        payload.put("to", target.name());
        if (reason != null && !reason.isBlank()) {
            payload.put("reason", reason.trim());
        }
        raise(EVENT_STATUS_CHANGED, actorId, now, payload);
    }

    /**
     * Sets the role without policy checks; callers consult the business rules first.
     *
     * @return {@code false} when the user already holds {@code target}
     */
    public boolean changeRole(UserRole target, UUID actorId, OffsetDateTime now) {
        if (target == null) {
            throw ValidationException.of("role", "required", "must be provided");
        }
        if (target == role) {
            return false;
        }
        UserRole from = role;
        role = target;
        raise(EVENT_ROLE_CHANGED, actorId, now, Map.of("from", from.name(), "to", target.name()));
        return true;
    }

    public void recordLoginSuccess(OffsetDateTime now) {
        lastLoginAt = now;
        failedLoginAttempts = 0;
        raise(EVENT_LOGIN_SUCCEEDED, id, now, Map.of("loggedInAt", now.toString()));
    }

    /**
     * @return the failed attempt count including this one
     */
    public int recordLoginFailure(OffsetDateTime now) {
        failedLoginAttempts++;
        raise(EVENT_LOGIN_FAILED, id, now, Map.of("failedAttempts", failedLoginAttempts));
        return failedLoginAttempts;
    }

    public UserSnapshot snapshot() {
        return new UserSnapshot(
                id,
                Email.of(email),
                firstName,
                lastName,
                role,
                status,
                bio,
                skills,
                registeredAt,
                emailChangedAt,
                lastLoginAt,
                failedLoginAttempts
        );
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

    private static void validateName(Violations violations, String field, String value, boolean required) {
        if (value == null) {
            if (required) {
                violations.add(field, "required", "must not be blank");
            }
            return;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            violations.add(field, "required", "must not be blank");
        } else if (trimmed.length() > MAX_NAME_LENGTH) {
            violations.add(field, "too_long", "must not exceed " + MAX_NAME_LENGTH + " characters");
        } else if (!NAME_PATTERN.matcher(trimmed).matches()) {
            violations.add(field, "invalid_characters", "may contain only letters, spaces, hyphens and apostrophes");
        }
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }

    private static String normalizeOptional(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static List<String> normalizeItems(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(values.stream().map(String::trim).toList());
    }

    public UUID getId() {
        return id;
    }

    public Email getEmail() {
        return Email.of(email);
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public UserRole getRole() {
        return role;
    }

    public UserStatus getStatus() {
        return status;
    }

    public String getBio() {
        return bio;
    }

    public List<String> getSkills() {
        return List.copyOf(skills);
    }

    public OffsetDateTime getRegisteredAt() {
        return registeredAt;
    }

    public OffsetDateTime getEmailChangedAt() {
        return emailChangedAt;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }
}
