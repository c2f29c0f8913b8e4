package com.tutorhub.backend.modules.matching.presentation;

import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.web.ActorHeaders;
import com.tutorhub.backend.global.web.PageParams;
import com.tutorhub.backend.global.web.PageResponse;
import com.tutorhub.backend.modules.matching.application.MatchingRequestService;
import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.presentation.dto.CancelMatchingRequestRequest;
import com.tutorhub.backend.modules.matching.presentation.dto.CreateMatchingRequestRequest;
import com.tutorhub.backend.modules.matching.presentation.dto.MatchTutorRequest;
import com.tutorhub.backend.modules.matching.presentation.dto.MatchingRequestResponse;
import com.tutorhub.backend.modules.matching.presentation.dto.UpdateMatchingRequestRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Matching Requests")
@RestController
@RequestMapping("/matching-requests")
public class MatchingRequestController {

    private final MatchingRequestService matchingRequestService;

    public MatchingRequestController(MatchingRequestService matchingRequestService) {
        this.matchingRequestService = matchingRequestService;
    }

    @Operation(summary = "Open a matching request", description = "The student must exist and be active.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "Student not found"),
            @ApiResponse(responseCode = "409", description = "Student is not active"),
            @ApiResponse(responseCode = "422", description = "Invalid request fields")
    })
    @PostMapping
    public ResponseEntity<MatchingRequestResponse> createRequest(
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody CreateMatchingRequestRequest request
    ) {
        MatchingRequest created = matchingRequestService.createRequest(
                request.toNewRequest(),
                ActorHeaders.parse(actorHeader)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<MatchingRequestResponse> getRequest(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(toResponse(matchingRequestService.getRequest(requestId)));
    }

    @Operation(summary = "List matching requests", description = "Newest first; filter by student with studentId.")
    @GetMapping
    public ResponseEntity<PageResponse<MatchingRequestResponse>> listRequests(
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "studentId", required = false) UUID studentId
    ) {
        PageParams page = PageParams.of(offset, limit);
        PageResult<MatchingRequest> result = studentId == null
                ? matchingRequestService.listRequests(page.offset(), page.limit())
                : matchingRequestService.listByStudent(studentId, page.offset(), page.limit());
        return ResponseEntity.ok(PageResponse.from(result, this::toResponse));
    }

    @PatchMapping("/{requestId}")
    public ResponseEntity<MatchingRequestResponse> updateRequest(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody UpdateMatchingRequestRequest request
    ) {
        MatchingRequest updated = matchingRequestService.updateRequest(
                requestId,
                request.toChanges(),
                ActorHeaders.parse(actorHeader)
        );
        return ResponseEntity.ok(toResponse(updated));
    }

    @Operation(summary = "Match a request with a tutor")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matched"),
            @ApiResponse(responseCode = "404", description = "Request or tutor not found"),
            @ApiResponse(responseCode = "409", description = "Tutor not eligible or request expired"),
            @ApiResponse(responseCode = "422", description = "Request is no longer pending")
    })
    @PostMapping("/{requestId}/match")
    public ResponseEntity<MatchingRequestResponse> matchWithTutor(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody MatchTutorRequest request
    ) {
        MatchingRequest matched = matchingRequestService.matchWithTutor(
                requestId,
                request.tutorId(),
                ActorHeaders.parse(actorHeader)
        );
        return ResponseEntity.ok(toResponse(matched));
    }

    @PostMapping("/{requestId}/cancel")
    public ResponseEntity<MatchingRequestResponse> cancelRequest(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody(required = false) CancelMatchingRequestRequest request
    ) {
        String reason = request == null ? null : request.reason();
        MatchingRequest cancelled = matchingRequestService.cancelRequest(
                requestId,
                reason,
                ActorHeaders.parse(actorHeader)
        );
        return ResponseEntity.ok(toResponse(cancelled));
    }

    private MatchingRequestResponse toResponse(MatchingRequest request) {
        return new MatchingRequestResponse(
                request.getId(),
                request.getStudentId(),
                request.getSubject().name(),
                request.getPreferredExperienceLevel() == null ? null : request.getPreferredExperienceLevel().name(),
                request.getMaxHourlyRate(),
                request.getPreferredLanguages(),
                request.getDescription(),
                request.getStatus().name(),
                request.getMatchedTutorId(),
                request.getCancellationReason(),
                request.getRequestedAt(),
                request.getExpiresAt(),
                request.getClosedAt()
        );
    }
}
