package com.tutorhub.backend.global.domain;

public record FieldViolation(String field, String code, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
