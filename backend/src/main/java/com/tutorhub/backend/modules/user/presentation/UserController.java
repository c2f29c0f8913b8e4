package com.tutorhub.backend.modules.user.presentation;

import java.util.UUID;

import com.tutorhub.backend.global.web.ActorHeaders;
import com.tutorhub.backend.global.web.PageParams;
import com.tutorhub.backend.global.web.PageResponse;
import com.tutorhub.backend.modules.user.application.UserService;
import com.tutorhub.backend.modules.user.application.UserService.EligibilityReport;
import com.tutorhub.backend.modules.user.application.UserService.LoginAttemptResult;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.presentation.dto.ChangeUserRoleRequest;
import com.tutorhub.backend.modules.user.presentation.dto.ChangeUserStatusRequest;
import com.tutorhub.backend.modules.user.presentation.dto.CreateUserRequest;
import com.tutorhub.backend.modules.user.presentation.dto.EligibilityResponse;
import com.tutorhub.backend.modules.user.presentation.dto.LoginAttemptRequest;
import com.tutorhub.backend.modules.user.presentation.dto.LoginAttemptResponse;
import com.tutorhub.backend.modules.user.presentation.dto.UpdateUserRequest;
import com.tutorhub.backend.modules.user.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Users")
@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @Operation(summary = "Register a user", description = "Creates a user in PENDING_VERIFICATION status.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "E-mail already in use"),
            @ApiResponse(responseCode = "422", description = "Invalid fields")
    })
    @PostMapping
    public ResponseEntity<UserResponse> createUser(
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody CreateUserRequest request
    ) {
        User user = userService.createUser(request.toNewUser(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(user));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(toResponse(userService.getUser(userId)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<UserResponse>> listUsers(
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        PageParams page = PageParams.of(offset, limit);
        return ResponseEntity.ok(PageResponse.from(
                userService.listUsers(page.offset(), page.limit()),
                this::toResponse
        ));
    }

    @Operation(summary = "Update profile fields", description = "Only provided fields are changed.")
    @PatchMapping("/{userId}")
    public ResponseEntity<UserResponse> updateProfile(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody UpdateUserRequest request
    ) {
        User user = userService.updateProfile(userId, request.toChanges(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(user));
    }

    @PatchMapping("/{userId}/status")
    public ResponseEntity<UserResponse> changeStatus(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody ChangeUserStatusRequest request
    ) {
        User user = userService.changeStatus(userId, request.status(), request.reason(),
                ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(user));
    }

    @PatchMapping("/{userId}/role")
    public ResponseEntity<UserResponse> changeRole(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody ChangeUserRoleRequest request
    ) {
        User user = userService.changeRole(userId, request.role(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(user));
    }

    @PostMapping("/{userId}/become-tutor")
    public ResponseEntity<UserResponse> becomeTutor(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader
    ) {
        User user = userService.becomeTutor(userId, ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(user));
    }

    @Operation(summary = "Record a login outcome", description = "Repeated failures suspend the account.")
    @PostMapping("/{userId}/login-attempts")
    public ResponseEntity<LoginAttemptResponse> recordLoginAttempt(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody LoginAttemptRequest request
    ) {
        LoginAttemptResult result = userService.recordLoginAttempt(userId, request.success());
        return ResponseEntity.ok(new LoginAttemptResponse(
                result.userId(),
                result.status().name(),
                result.failedAttempts(),
                result.locked()
        ));
    }

    @GetMapping("/{userId}/eligibility")
    public ResponseEntity<EligibilityResponse> evaluateEligibility(
            @PathVariable("userId") UUID userId,
            @RequestParam(name = "reputationScore", defaultValue = "0") int reputationScore
    ) {
        EligibilityReport report = userService.evaluateEligibility(userId, reputationScore);
        return ResponseEntity.ok(new EligibilityResponse(
                report.userId(),
                report.accountAgeDays(),
                report.canBecomeTutor(),
                report.hasPremiumAccess(),
                report.shouldLockAccount(),
                report.profileComplete()
        ));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> deleteUser(
            @PathVariable("userId") UUID userId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader
    ) {
        userService.deleteUser(userId, ActorHeaders.parse(actorHeader));
        return ResponseEntity.noContent().build();
    }

    private UserResponse toResponse(User user) {
        return new UserResponse(
                user.getId(),
                user.getEmail().value(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole().name(),
                user.getStatus().name(),
                user.getBio(),
                user.getSkills(),
                user.getRegisteredAt(),
                user.getEmailChangedAt(),
                user.getLastLoginAt(),
                user.getFailedLoginAttempts()
        );
    }
}
