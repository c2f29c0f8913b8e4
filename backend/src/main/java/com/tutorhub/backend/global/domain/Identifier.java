package com.tutorhub.backend.global.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical UUID identifier. Accepts only the 36-character hyphenated form.
 */
public final class Identifier {

    private final UUID value;

    private Identifier(UUID value) {
        this.value = value;
    }

    public static Identifier generate() {
        return new Identifier(UUID.randomUUID());
    }

    public static Identifier of(UUID value) {
        if (value == null) {
            throw ValidationException.of("id", "required", "must not be null");
        }
        return new Identifier(value);
    }

    public static Identifier of(String raw) {
        return of("id", raw);
    }

    public static Identifier of(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw ValidationException.of(field, "required", "must not be blank");
        }
        String trimmed = raw.trim();
        if (trimmed.length() != 36) {
            throw ValidationException.of(field, "invalid_format", "must be a UUID");
        }
        try {
            UUID parsed = UUID.fromString(trimmed);
            if (!parsed.toString().equals(trimmed.toLowerCase(Locale.ROOT))) {
                throw ValidationException.of(field, "invalid_format", "must be a UUID");
            }
            return new Identifier(parsed);
        } catch (IllegalArgumentException ex) {
            throw ValidationException.of(field, "invalid_format", "must be a UUID");
        }
    }

    public UUID value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identifier other)) {
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
        return value.toString();
    }
}
