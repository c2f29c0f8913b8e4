package com.tutorhub.backend.global.error;

import java.util.List;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.InvalidStateException;
import com.tutorhub.backend.global.domain.InvalidTransitionException;
import com.tutorhub.backend.global.domain.ValidationException;
import com.tutorhub.backend.modules.event.domain.PublishException;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);
    private static final String REQUEST_ID_MDC_KEY = "requestId";

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        return respond(status, ex.getCode(), ex.getDetailMessage(), request, null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = resolveStatus(ex.getStatusCode());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return respond(status, message, message, request, null);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemResponse> handleDomainValidation(ValidationException ex, HttpServletRequest request) {
        List<ProblemResponse.Violation> violations = ex.getViolations().stream()
                .map(v -> new ProblemResponse.Violation(v.field(), v.code(), v.message()))
                .toList();
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", ex.getMessage(), request, violations);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ProblemResponse> handleInvalidTransition(
            InvalidTransitionException ex,
            HttpServletRequest request
    ) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_transition", ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ProblemResponse> handleInvalidState(InvalidStateException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "invalid_state", ex.getMessage(), request, null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ProblemResponse> handleConflict(ConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage(), request, null);
    }

    @ExceptionHandler(PublishException.class)
    public ResponseEntity<ProblemResponse> handlePublishFailure(PublishException ex, HttpServletRequest request) {
        log.error("Event publishing failed, request rolled back: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "event_publish_failed",
                "The change could not be recorded, please retry", request, null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        List<ProblemResponse.Violation> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toViolation)
                .toList();
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "validation_error", detail, request, violations);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ProblemResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error", request, null);
    }

    private ResponseEntity<ProblemResponse> respond(
            HttpStatus status,
            String code,
            String detail,
            HttpServletRequest request,
            List<ProblemResponse.Violation> violations
    ) {
        ProblemResponse body = ProblemResponse.of(
                status,
                code,
                detail,
                request.getRequestURI(),
                MDC.get(REQUEST_ID_MDC_KEY),
                violations
        );
        return ResponseEntity.status(status).body(body);
    }

    private ProblemResponse.Violation toViolation(FieldError fieldError) {
        return new ProblemResponse.Violation(
                fieldError.getField(),
                fieldError.getCode() != null ? fieldError.getCode() : "invalid",
                fieldError.getDefaultMessage()
        );
    }

    private HttpStatus resolveStatus(HttpStatusCode statusCode) {
        return statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
    }
}
