package com.tutorhub.backend.modules.matching.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.modules.matching.domain.MatchingRequest;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestRepository;
import com.tutorhub.backend.modules.matching.domain.MatchingRequestStatus;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JpaMatchingRequestRepositoryAdapter implements MatchingRequestRepository {

    private final MatchingRequestJpaRepository matchingRequestJpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaMatchingRequestRepositoryAdapter(MatchingRequestJpaRepository matchingRequestJpaRepository) {
        this.matchingRequestJpaRepository = matchingRequestJpaRepository;
    }

    @Override
    @Transactional
    public void save(MatchingRequest request) {
        if (entityManager.contains(request) || matchingRequestJpaRepository.existsById(request.getId())) {
            matchingRequestJpaRepository.save(request);
        } else {
            entityManager.persist(request);
        }
        entityManager.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MatchingRequest> findById(UUID id) {
        return matchingRequestJpaRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<MatchingRequest> findAll(int offset, int limit) {
        List<MatchingRequest> items = entityManager
                .createQuery("""
                        select r
                          from MatchingRequest r
                         order by r.requestedAt desc, r.id asc
                        """, MatchingRequest.class)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        Long total = entityManager.createQuery("select count(r) from MatchingRequest r", Long.class)
                .getSingleResult();
        return new PageResult<>(items, total, offset, limit);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<MatchingRequest> findByStudentId(UUID studentId, int offset, int limit) {
        List<MatchingRequest> items = entityManager
                .createQuery("""
                        select r
                          from MatchingRequest r
                         where r.studentId = :studentId
                         order by r.requestedAt desc, r.id asc
                        """, MatchingRequest.class)
                .setParameter("studentId", studentId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        long total = matchingRequestJpaRepository.countByStudentId(studentId);
        return new PageResult<>(items, total, offset, limit);
    }

    @Override
    @Transactional(readOnly = true)
    public List<MatchingRequest> findExpirable(OffsetDateTime now, int limit) {
        return matchingRequestJpaRepository.findByStatusAndExpiresAtBefore(
                MatchingRequestStatus.PENDING,
                now,
                PageRequest.of(0, limit, Sort.by("expiresAt").ascending())
        );
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        if (!matchingRequestJpaRepository.existsById(id)) {
            return false;
        }
        matchingRequestJpaRepository.deleteById(id);
        return true;
    }
}
