package com.tutorhub.backend.modules.user.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.modules.user.domain.User;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserJpaRepository extends JpaRepository<User, UUID> {

    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
