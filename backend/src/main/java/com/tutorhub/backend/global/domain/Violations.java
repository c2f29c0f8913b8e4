package com.tutorhub.backend.global.domain;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Collects field violations so a factory or mutation can report all of them at once.
 */
public final class Violations {

    private final List<FieldViolation> violations = new ArrayList<>();

    public Violations add(String field, String code, String message) {
        violations.add(new FieldViolation(field, code, message));
        return this;
    }

    public Violations addAll(ValidationException ex) {
        violations.addAll(ex.getViolations());
        return this;
    }

    /**
     * Runs a value-object factory and records its violations instead of propagating them.
     * Returns {@code null} when the factory rejected the input.
     */
    public <T> T capture(Supplier<T> factory) {
        try {
            return factory.get();
        } catch (ValidationException ex) {
            addAll(ex);
            return null;
        }
    }

    public Violations requireText(String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            add(field, "required", "must not be blank");
        } else if (value.trim().length() > maxLength) {
            add(field, "too_long", "must not exceed " + maxLength + " characters");
        }
        return this;
    }

    public Violations optionalText(String field, String value, int maxLength) {
        if (value != null && value.trim().length() > maxLength) {
            add(field, "too_long", "must not exceed " + maxLength + " characters");
        }
        return this;
    }

    public Violations requireNonNull(String field, Object value) {
        if (value == null) {
            add(field, "required", "must be provided");
        }
        return this;
    }

    public Violations nonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            add(field, "negative", "must be zero or greater");
        }
        return this;
    }

    public Violations textItems(String field, Collection<String> values, int maxItems, int maxItemLength) {
        if (values == null) {
            return this;
        }
        if (values.size() > maxItems) {
            add(field, "too_many", "must not contain more than " + maxItems + " entries");
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                add(field, "blank_entry", "must not contain blank entries");
                break;
            }
            if (value.trim().length() > maxItemLength) {
                add(field, "entry_too_long", "entries must not exceed " + maxItemLength + " characters");
                break;
            }
        }
        return this;
    }

    public boolean isEmpty() {
        return violations.isEmpty();
    }

    public void throwIfAny() {
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }
}
