package com.tutorhub.backend.modules.tutor.infrastructure.memory;

import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.memory.InMemoryAggregateRepository;
import com.tutorhub.backend.modules.tutor.domain.Tutor;
import com.tutorhub.backend.modules.tutor.domain.TutorRepository;

public class InMemoryTutorRepository extends InMemoryAggregateRepository<Tutor> implements TutorRepository {

    public InMemoryTutorRepository() {
        super(
                Tutor::getId,
                "userId",
                tutor -> tutor.getUserId().toString(),
                null
        );
    }

    @Override
    public void save(Tutor tutor) {
        put(tutor);
    }

    @Override
    public Optional<Tutor> findById(UUID id) {
        return get(id);
    }

    @Override
    public Optional<Tutor> findByUserId(UUID userId) {
        return getByUniqueKey(userId.toString());
    }

    @Override
    public boolean existsByUserId(UUID userId) {
        return getByUniqueKey(userId.toString()).isPresent();
    }

    @Override
    public PageResult<Tutor> findAll(int offset, int limit) {
        return page(offset, limit);
    }

    @Override
    public boolean delete(UUID id) {
        return remove(id);
    }
}
