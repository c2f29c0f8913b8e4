package com.tutorhub.backend.modules.user.domain;

import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.PageResult;

public interface UserRepository {

    /**
     * Inserts or updates by id.
     *
     * @throws com.tutorhub.backend.global.domain.ConflictException when the e-mail belongs to another user
     */
    void save(User user);

    Optional<User> findById(UUID id);

    Optional<User> findByEmail(Email email);

    boolean existsByEmail(Email email);

    PageResult<User> findAll(int offset, int limit);

    boolean delete(UUID id);
}
