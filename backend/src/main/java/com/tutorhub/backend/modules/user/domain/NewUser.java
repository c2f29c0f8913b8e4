package com.tutorhub.backend.modules.user.domain;

import java.util.List;

/**
 * Input for {@link User#register}. {@code role} defaults to STUDENT, {@code skills} to empty.
 */
public record NewUser(
        String email,
        String firstName,
        String lastName,
        UserRole role,
        String bio,
        List<String> skills
) {
}
