package com.tutorhub.backend.modules.user.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.global.error.ProblemException;
import com.tutorhub.backend.modules.event.application.DomainEventPublisher;
import com.tutorhub.backend.modules.user.domain.NewUser;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserChanges;
import com.tutorhub.backend.modules.user.domain.UserRepository;
import com.tutorhub.backend.modules.user.domain.UserRole;
import com.tutorhub.backend.modules.user.domain.UserSnapshot;
import com.tutorhub.backend.modules.user.domain.UserStatus;
import com.tutorhub.backend.modules.user.domain.rules.UserBusinessRules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final String LOCK_REASON = "too_many_failed_logins";

    private final UserRepository userRepository;
    private final UserBusinessRules businessRules;
    private final DomainEventPublisher eventPublisher;
    private final Clock clock;

    public UserService(
            UserRepository userRepository,
            UserBusinessRules businessRules,
            DomainEventPublisher eventPublisher,
            Clock clock
    ) {
        this.userRepository = userRepository;
        this.businessRules = businessRules;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public User createUser(NewUser props, UUID actorId) {
        User user = User.register(props, actorId, now());
        if (userRepository.existsByEmail(user.getEmail())) {
            throw new ConflictException("email", "email already in use: " + user.getEmail());
        }
        commit(user);
        log.info("User registered userId={} role={}", user.getId(), user.getRole());
        return user;
    }

    @Transactional(readOnly = true)
    public User getUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", userId));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PageResult<User> listUsers(int offset, int limit) {
        return userRepository.findAll(offset, limit);
    }

    public User updateProfile(UUID userId, UserChanges changes, UUID actorId) {
        User user = getUser(userId);
        OffsetDateTime now = now();
        if (changes.email() != null) {
            Email newEmail = Email.of("email", changes.email());
            if (!newEmail.equals(user.getEmail())) {
                if (!businessRules.canChangeEmail(user.snapshot(), newEmail, now)) {
                    throw new ProblemException(HttpStatus.CONFLICT, "EMAIL_CHANGE_NOT_ALLOWED",
                            "E-mail can be changed only by active users, once per "
                                    + businessRules.policy().emailChangeCooldownDays() + " days");
                }
                userRepository.findByEmail(newEmail)
                        .filter(other -> !other.getId().equals(userId))
                        .ifPresent(other -> {
                            throw new ConflictException("email", "email already in use: " + newEmail);
                        });
            }
        }
        if (user.update(changes, actorId, now)) {
            commit(user);
        }
        return user;
    }

    public User changeStatus(UUID userId, UserStatus target, String reason, UUID actorId) {
        if (target == null) {
            throw ValidationException.of("status", "required", "must be provided");
        }
        User user = getUser(userId);
        UserStatus from = user.getStatus();
        user.transition(target, actorId, reason, now());
        commit(user);
        log.info("User status changed userId={} {} -> {}", userId, from, target);
        return user;
    }

    public User changeRole(UUID userId, UserRole target, UUID actorId) {
        if (target == null) {
            throw ValidationException.of("role", "required", "must be provided");
        }
        User user = getUser(userId);
        OffsetDateTime now = now();
        if (!businessRules.canTransitionRole(user.getRole(), target, user.snapshot(), now)) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROLE_TRANSITION_NOT_ALLOWED",
                    "Role change " + user.getRole() + " -> " + target + " is not allowed");
        }
        user.changeRole(target, actorId, now);
        commit(user);
        return user;
    }

    public User becomeTutor(UUID userId, UUID actorId) {
        User user = getUser(userId);
        OffsetDateTime now = now();
        if (!businessRules.canBecomeTutor(user.snapshot(), now)) {
            throw new ProblemException(HttpStatus.CONFLICT, "NOT_ELIGIBLE_FOR_TUTOR",
                    "Only active students registered for at least "
                            + businessRules.policy().minRegistrationDaysForTutor() + " days can become tutors");
        }
        user.changeRole(UserRole.TUTOR, actorId, now);
        commit(user);
        log.info("User promoted to tutor userId={}", userId);
        return user;
    }

    /**
     * Records one login outcome. Repeated failures suspend an active account.
     */
    public LoginAttemptResult recordLoginAttempt(UUID userId, boolean success) {
        User user = getUser(userId);
        OffsetDateTime now = now();
        if (success) {
            if (user.getStatus() != UserStatus.ACTIVE) {
                throw new ProblemException(HttpStatus.CONFLICT, "ACCOUNT_NOT_ACTIVE",
                        "Login is not possible while the account is " + user.getStatus());
            }
            user.recordLoginSuccess(now);
            commit(user);
            return new LoginAttemptResult(userId, user.getStatus(), 0, false);
        }

        boolean wasActive = user.getStatus() == UserStatus.ACTIVE;
        int attempts = user.recordLoginFailure(now);
        boolean locked = false;
        if (wasActive && businessRules.shouldLockAccount(user.snapshot(), attempts)) {
            user.transition(UserStatus.SUSPENDED, null, LOCK_REASON, now);
            locked = true;
            log.warn("Account locked after {} failed logins userId={}", attempts, userId);
        }
        commit(user);
        return new LoginAttemptResult(userId, user.getStatus(), attempts, locked);
    }

    @Transactional(readOnly = true)
    public EligibilityReport evaluateEligibility(UUID userId, int reputationScore) {
        User user = getUser(userId);
        OffsetDateTime now = now();
        UserSnapshot snapshot = user.snapshot();
        return new EligibilityReport(
                userId,
                businessRules.accountAgeDays(snapshot, now),
                businessRules.canBecomeTutor(snapshot, now),
                businessRules.hasPremiumAccess(snapshot, reputationScore),
                businessRules.shouldLockAccount(snapshot, snapshot.failedLoginAttempts()),
                businessRules.isProfileComplete(snapshot)
        );
    }

    /**
     * Administrative removal; business flows deactivate instead.
     */
    public void deleteUser(UUID userId, UUID actorId) {
        if (!userRepository.delete(userId)) {
            throw ProblemException.notFound("USER_NOT_FOUND", userId);
        }
        log.warn("User deleted userId={} actorId={}", userId, actorId);
    }

    private void commit(User user) {
        userRepository.save(user);
        eventPublisher.publishPending(user);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public record LoginAttemptResult(UUID userId, UserStatus status, int failedAttempts, boolean locked) {
    }

    public record EligibilityReport(
            UUID userId,
            long accountAgeDays,
            boolean canBecomeTutor,
            boolean hasPremiumAccess,
            boolean shouldLockAccount,
            boolean profileComplete
    ) {
    }
}
