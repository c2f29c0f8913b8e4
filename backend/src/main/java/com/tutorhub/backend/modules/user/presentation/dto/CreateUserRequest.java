package com.tutorhub.backend.modules.user.presentation.dto;

import java.util.List;

import com.tutorhub.backend.modules.user.domain.NewUser;
import com.tutorhub.backend.modules.user.domain.UserRole;

/**
 * Field rules live on the aggregate so every violation is reported together.
 */
public record CreateUserRequest(
        String email,
        String firstName,
        String lastName,
        UserRole role,
        String bio,
        List<String> skills
) {

    public NewUser toNewUser() {
        return new NewUser(email, firstName, lastName, role, bio, skills);
    }
}
