package com.tutorhub.backend.modules.matching.infrastructure.memory;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.memory.InMemoryAggregateRepository;
import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestRepository;

public class InMemoryMatchingRequestRepository extends InMemoryAggregateRepository<MatchingRequest>
        implements MatchingRequestRepository {

    private static final Comparator<MatchingRequest> NEWEST_FIRST =
            Comparator.comparing(MatchingRequest::getRequestedAt).reversed().thenComparing(MatchingRequest::getId);

    public InMemoryMatchingRequestRepository() {
        super(MatchingRequest::getId, null, null, NEWEST_FIRST);
    }

    @Override
    public void save(MatchingRequest request) {
        put(request);
    }

    @Override
    public Optional<MatchingRequest> findById(UUID id) {
        return get(id);
    }

    @Override
    public PageResult<MatchingRequest> findAll(int offset, int limit) {
        return page(offset, limit);
    }

    @Override
    public PageResult<MatchingRequest> findByStudentId(UUID studentId, int offset, int limit) {
        List<MatchingRequest> all = filter(request -> request.getStudentId().equals(studentId), Integer.MAX_VALUE);
        List<MatchingRequest> items = offset >= all.size()
                ? List.of()
                : all.subList(offset, Math.min(all.size(), offset + limit));
        return new PageResult<>(items, all.size(), offset, limit);
    }

    @Override
    public List<MatchingRequest> findExpirable(OffsetDateTime now, int limit) {
        return filter(request -> request.isPending() && request.getExpiresAt().isBefore(now), Integer.MAX_VALUE)
                .stream()
                .sorted(Comparator.comparing(MatchingRequest::getExpiresAt))
                .limit(limit)
                .toList();
    }

    @Override
    public boolean delete(UUID id) {
        return remove(id);
    }
}
