package com.tutorhub.backend.modules.user.domain;

public enum UserRole {
    STUDENT,
    TUTOR,
    ADMIN,
    SUPER_ADMIN;

    public boolean isPrivileged() {
        return this == ADMIN || this == SUPER_ADMIN;
    }

    public boolean canTeach() {
        return this == TUTOR;
    }

    public boolean canManageUsers() {
        return isPrivileged();
    }
}
