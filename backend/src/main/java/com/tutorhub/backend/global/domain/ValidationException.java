package com.tutorhub.backend.global.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised by value objects and aggregates when input is invalid. Carries every violated field,
 * not only the first one found.
 */
public class ValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public ValidationException(List<FieldViolation> violations) {
        super(describe(violations));
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("ValidationException requires at least one violation");
        }
        this.violations = List.copyOf(violations);
    }

    public static ValidationException of(String field, String code, String message) {
        return new ValidationException(List.of(new FieldViolation(field, code, message)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    public List<String> getFields() {
        return violations.stream().map(FieldViolation::field).distinct().toList();
    }

    private static String describe(List<FieldViolation> violations) {
        if (violations == null || violations.isEmpty()) {
            return "Validation failed";
        }
        return violations.stream().map(FieldViolation::toString).collect(Collectors.joining("; "));
    }
}
