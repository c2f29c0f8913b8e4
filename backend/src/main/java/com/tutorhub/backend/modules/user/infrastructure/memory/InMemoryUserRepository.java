package com.tutorhub.backend.modules.user.infrastructure.memory;

import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;

import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.global.memory.InMemoryAggregateRepository;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserRepository;

public class InMemoryUserRepository extends InMemoryAggregateRepository<User> implements UserRepository {

    public InMemoryUserRepository() {
        super(
                User::getId,
                "email",
                user -> user.getEmail().value(),
                Comparator.comparing(User::getRegisteredAt).thenComparing(User::getId)
        );
    }

    @Override
    public void save(User user) {
        put(user);
    }

    @Override
    public Optional<User> findById(UUID id) {
        return get(id);
    }

    @Override
    public Optional<User> findByEmail(Email email) {
        return getByUniqueKey(email.value());
    }

    @Override
    public boolean existsByEmail(Email email) {
        return getByUniqueKey(email.value()).isPresent();
    }

    @Override
    public PageResult<User> findAll(int offset, int limit) {
        return page(offset, limit);
    }

    @Override
    public boolean delete(UUID id) {
        return remove(id);
    }
}
