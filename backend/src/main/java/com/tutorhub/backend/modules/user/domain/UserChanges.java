package com.tutorhub.backend.modules.user.domain;

import java.util.List;

/**
 * Partial profile update. A {@code null} component leaves that field untouched.
 */
public record UserChanges(
        String email,
        String firstName,
        String lastName,
        String bio,
        List<String> skills
) {

    public static UserChanges none() {
        return new UserChanges(null, null, null, null, null);
    }
}
