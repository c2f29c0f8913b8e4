package com.tutorhub.backend.modules.matching.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestStatus;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MatchingRequestJpaRepository extends JpaRepository<MatchingRequest, UUID> {

    List<MatchingRequest> findByStatusAndExpiresAtBefore(
            MatchingRequestStatus status,
            OffsetDateTime threshold,
            Pageable pageable
    );

    long countByStudentId(UUID studentId);
}
