package com.tutorhub.backend.modules.matching.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;

public interface MatchingRequestRepository {

    void save(MatchingRequest request);

    Optional<MatchingRequest> findById(UUID id);

    PageResult<MatchingRequest> findAll(int offset, int limit);

    PageResult<MatchingRequest> findByStudentId(UUID studentId, int offset, int limit);

    /**
     * Pending requests whose expiry lies before {@code now}, oldest expiry first.
     */
    List<MatchingRequest> findExpirable(OffsetDateTime now, int limit);

    boolean delete(UUID id);
}
