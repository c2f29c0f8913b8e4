package com.tutorhub.backend.modules.tutor.presentation;

import java.util.UUID;

import com.tutorhub.backend.global.web.ActorHeaders;
import com.tutorhub.backend.global.web.PageParams;
import com.tutorhub.backend.global.web.PageResponse;
import com.tutorhub.backend.modules.tutor.application.TutorService;
import com.tutorhub.backend.modules.tutor.application.TutorService.TierReport;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.presentation.dto.ChangeTutorStatusRequest;
import com.tutorhub.backend.modules.tutor.presentation.dto.CreateTutorRequest;
import com.tutorhub.backend.modules.tutor.presentation.dto.RecordSessionRequest;
import com.tutorhub.backend.modules.tutor.presentation.dto.TutorResponse;
import com.tutorhub.backend.modules.tutor.presentation.dto.TutorTierResponse;
import com.tutorhub.backend.modules.tutor.presentation.dto.UpdateRatingRequest;
import com.tutorhub.backend.modules.tutor.presentation.dto.UpdateTutorRequest;

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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Tutors")
@RestController
@RequestMapping("/tutors")
public class TutorController {

    private final TutorService tutorService;

    public TutorController(TutorService tutorService) {
        this.tutorService = tutorService;
    }

    @Operation(summary = "Create a tutor profile", description = "The owning user must hold the TUTOR role.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "User is not a tutor or already has a profile")
    })
    @PostMapping
    public ResponseEntity<TutorResponse> createTutor(
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody CreateTutorRequest request
    ) {
        Tutor tutor = tutorService.createTutor(request.toNewTutor(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(tutor));
    }

    @GetMapping("/{tutorId}")
    public ResponseEntity<TutorResponse> getTutor(@PathVariable("tutorId") UUID tutorId) {
        return ResponseEntity.ok(toResponse(tutorService.getTutor(tutorId)));
    }

    @GetMapping("/by-user/{userId}")
    public ResponseEntity<TutorResponse> getTutorByUserId(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(toResponse(tutorService.getTutorByUserId(userId)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<TutorResponse>> listTutors(
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        PageParams page = PageParams.of(offset, limit);
        return ResponseEntity.ok(PageResponse.from(
                tutorService.listTutors(page.offset(), page.limit()),
                this::toResponse
        ));
    }

    @PatchMapping("/{tutorId}")
    public ResponseEntity<TutorResponse> updateProfile(
            @PathVariable("tutorId") UUID tutorId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @RequestBody UpdateTutorRequest request
    ) {
        Tutor tutor = tutorService.updateProfile(tutorId, request.toChanges(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(tutor));
    }

    @PatchMapping("/{tutorId}/status")
    public ResponseEntity<TutorResponse> changeStatus(
            @PathVariable("tutorId") UUID tutorId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody ChangeTutorStatusRequest request
    ) {
        Tutor tutor = tutorService.changeStatus(tutorId, request.status(), request.reason(),
                ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(tutor));
    }

    @PutMapping("/{tutorId}/rating")
    public ResponseEntity<TutorResponse> updateRating(
            @PathVariable("tutorId") UUID tutorId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody UpdateRatingRequest request
    ) {
        Tutor tutor = tutorService.updateRating(tutorId, request.rating(), request.totalReviews(),
                ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(tutor));
    }

    @PostMapping("/{tutorId}/sessions")
    public ResponseEntity<TutorResponse> recordSession(
            @PathVariable("tutorId") UUID tutorId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader,
            @Valid @RequestBody RecordSessionRequest request
    ) {
        Tutor tutor = tutorService.recordSession(tutorId, request.outcome(), ActorHeaders.parse(actorHeader));
        return ResponseEntity.ok(toResponse(tutor));
    }

    @GetMapping("/{tutorId}/tier")
    public ResponseEntity<TutorTierResponse> getTier(@PathVariable("tutorId") UUID tutorId) {
        TierReport report = tutorService.getTier(tutorId);
        return ResponseEntity.ok(new TutorTierResponse(
                report.tutorId(),
                report.tier().name(),
                report.completedSessions(),
                report.reputationScore(),
                report.cancellationRate()
        ));
    }

    @DeleteMapping("/{tutorId}")
    public ResponseEntity<Void> deleteTutor(
            @PathVariable("tutorId") UUID tutorId,
            @RequestHeader(name = ActorHeaders.ACTOR_ID_HEADER, required = false) String actorHeader
    ) {
        tutorService.deleteTutor(tutorId, ActorHeaders.parse(actorHeader));
        return ResponseEntity.noContent().build();
    }

    private TutorResponse toResponse(Tutor tutor) {
        return new TutorResponse(
                tutor.getId(),
                tutor.getUserId(),
                tutor.getBio(),
                tutor.getSubjects().stream().map(Enum::name).toList(),
                tutor.getExperienceLevel().name(),
                tutor.getHourlyRate(),
                tutor.getCurrency(),
                tutor.getLanguages(),
                tutor.getEducation(),
                tutor.getStatus().name(),
                tutor.getRating(),
                tutor.getTotalReviews(),
                tutor.getCompletedSessions(),
                tutor.getCancelledSessions()
        );
    }
}
