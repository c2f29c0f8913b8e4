package com.tutorhub.backend.modules.user.presentation.dto;

import java.util.List;

import com.tutorhub.backend.modules.user.domain.UserChanges;

public record UpdateUserRequest(
        String email,
        String firstName,
        String lastName,
        String bio,
        List<String> skills
) {

    public UserChanges toChanges() {
        return new UserChanges(email, firstName, lastName, bio, skills);
    }
}
