package com.tutorhub.backend.modules.user.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.jpa.PersistenceErrors;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserRepository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JpaUserRepositoryAdapter implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaUserRepositoryAdapter(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    @Override
    @Transactional
    public void save(User user) {
        try {
            if (entityManager.contains(user) || userJpaRepository.existsById(user.getId())) {
                userJpaRepository.save(user);
            } else {
                entityManager.persist(user);
            }
            entityManager.flush();
        } catch (DataIntegrityViolationException | PersistenceException ex) {
            if (PersistenceErrors.isConstraintViolation(ex)) {
                throw new ConflictException("email", "email already in use: " + user.getEmail(), ex);
            }
            throw ex;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(UUID id) {
        return userJpaRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(Email email) {
        return userJpaRepository.findByEmail(email.value());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(Email email) {
        return userJpaRepository.existsByEmail(email.value());
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<User> findAll(int offset, int limit) {
        List<User> items = entityManager
                .createQuery("select u from User u order by u.registeredAt asc, u.id asc", User.class)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
        Long total = entityManager.createQuery("select count(u) from User u", Long.class).getSingleResult();
        return new PageResult<>(items, total, offset, limit);
    }

    @Override
    @Transactional
    public boolean delete(UUID id) {
        if (!userJpaRepository.existsById(id)) {
            return false;
        }
        userJpaRepository.deleteById(id);
        return true;
    }
}
