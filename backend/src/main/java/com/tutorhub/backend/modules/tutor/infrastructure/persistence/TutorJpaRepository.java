package com.tutorhub.backend.modules.tutor.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.modules.tutor.domain.Tutor;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TutorJpaRepository extends JpaRepository<Tutor, UUID> {

    Optional<Tutor> findByUserId(UUID userId);

    boolean existsByUserId(UUID userId);
}
