package com.tutorhub.backend.global.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Case-normalized e-mail address. Two instances are equal when their normalized values are.
 */
public final class Email {

    public static final int MAX_LENGTH = 254;

    private final String value;

    private Email(String value) {
        this.value = value;
    }

    public static Email of(String raw) {
        return of("email", raw);
    }

    public static Email of(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw ValidationException.of(field, "required", "must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_LENGTH) {
            throw ValidationException.of(field, "too_long", "must not exceed " + MAX_LENGTH + " characters");
        }
        int at = normalized.indexOf('@');
        if (at <= 0 || at != normalized.lastIndexOf('@') || at == normalized.length() - 1
                || normalized.chars().anyMatch(Character::isWhitespace)) {
            throw ValidationException.of(field, "invalid_format", "must be a valid e-mail address");
        }
        String domain = normalized.substring(at + 1);
        if (!domain.contains(".") || domain.startsWith(".") || domain.endsWith(".")) {
            throw ValidationException.of(field, "invalid_format", "must be a valid e-mail address");
        }
        return new Email(normalized);
    }

    public String value() {
        return value;
    }

    public String localPart() {
        return value.substring(0, value.indexOf('@'));
    }

    public String domain() {
        return value.substring(value.indexOf('@') + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Email other)) {
            return false;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
