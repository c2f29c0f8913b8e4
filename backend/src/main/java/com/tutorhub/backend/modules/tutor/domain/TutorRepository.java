package com.tutorhub.backend.modules.tutor.domain;

import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;

public interface TutorRepository {

    /**
     * @throws com.tutorhub.backend.global.domain.ConflictException when the user already has a tutor profile
     */
    void save(Tutor tutor);

    Optional<Tutor> findById(UUID id);

    Optional<Tutor> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);

    PageResult<Tutor> findAll(int offset, int limit);

    boolean delete(UUID id);
}
