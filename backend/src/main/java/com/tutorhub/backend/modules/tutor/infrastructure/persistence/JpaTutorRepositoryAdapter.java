package com.tutorhub.backend.modules.tutor.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.jpa.PersistenceErrors;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorRepository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JpaTutorRepositoryAdapter implements TutorRepository {

    private final TutorJpaRepository tutorJpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaTutorRepositoryAdapter(TutorJpaRepository tutorJpaRepository) {
        this.tutorJpaRepository = tutorJpaRepository;
    }

    @Override
    @Transactional
    public void save(Tutor tutor) {
        try {
            if (entityManager.contains(tutor) || tutorJpaRepository.existsById(tutor.getId())) {
                tutorJpaRepository.save(tutor);
            } else {
                entityManager.persist(tutor);
            }
            entityManager.flush();
        } catch (DataIntegrityViolationException | PersistenceException ex) {
            if (PersistenceErrors.isConstraintViolation(ex)) {
                throw new ConflictException("userId", "user already has a tutor profile: " + tutor.getUserId(), ex);
            }
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tutor> findById(UUID id) {
        return tutorJpaRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Tutor> findByUserId(UUID userId) {
        return tutorJpaRepository.findByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUserId(UUID userId) {
        return tutorJpaRepository.existsByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<Tutor> findAll(int offset, int limit) {
        List<Tutor> items = entityManager
                .createQuery("select t from Tutor t order by t.createdAt asc, t.id asc", Tutor.class)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        Long total = entityManager.createQuery("select count(t) from Tutor t", Long.class).getSingleResult();
        return new PageResult<>(items, total, offset, limit);
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        if (!tutorJpaRepository.existsById(id)) {
            return false;
        }
        tutorJpaRepository.deleteById(id);
        return true;
    }
}
