package com.tutorhub.backend.modules.user.infrastructure.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.List;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.Email;
import com.tutorhub.backend.global.domain.PageResult;
import com.tutorhub.backend.modules.user.domain.NewUser;
import com.tutorhub.backend.modules.user.domain.User;
import com.tutorhub.backend.modules.user.domain.UserChanges;

import org.junit.jupiter.api.Test;

class InMemoryUserRepositoryTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private final InMemoryUserRepository repository = new InMemoryUserRepository();

    @Test
    void saveIsAnUpsertKeyedById() {
        User user = register("alice@example.com", NOW);
        repository.save(user);
        repository.save(user);

        assertThat(repository.size()).isEqualTo(1);
        assertThat(repository.findByEmail(Email.of("ALICE@example.com"))).containsSame(user);
    }

    @Test
    void duplicateEmailOnAnotherUserConflicts() {
        repository.save(register("alice@example.com", NOW));

        assertThatThrownBy(() -> repository.save(register("alice@example.com", NOW)))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void changedEmailReleasesThePreviousAddress() {
        User alice = register("alice@example.com", NOW);
        repository.save(alice);

        alice.update(new UserChanges("alice@new.example.com", null, null, null, null), null, NOW);
        repository.save(alice);

        assertThat(repository.existsByEmail(Email.of("alice@example.com"))).isFalse();
        assertThat(repository.existsByEmail(Email.of("alice@new.example.com"))).isTrue();
        repository.save(register("alice@example.com", NOW));
        assertThat(repository.size()).isEqualTo(2);
    }

    @Test
    void rejectedEmailChangeKeepsTheIndexOnAcceptedKeys() {
        User alice = register("alice@example.com", NOW);
        User bob = register("bob@example.com", NOW);
        repository.save(alice);
        repository.save(bob);

        alice.update(new UserChanges("bob@example.com", null, null, null, null), null, NOW);

        assertThatThrownBy(() -> repository.save(alice)).isInstanceOf(ConflictException.class);
        assertThat(repository.findByEmail(Email.of("bob@example.com"))).containsSame(bob);
        assertThat(repository.findByEmail(Email.of("alice@example.com"))).containsSame(alice);
        // held by reference: the rejected change is still on the stored instance
        assertThat(repository.findById(alice.getId()).orElseThrow().getEmail().value())
                .isEqualTo("bob@example.com");
    }

    @Test
    void pagesAreOrderedByRegistrationAndReportTotal() {
        User late = register("late@example.com", NOW.plusDays(1));
        User early = register("early@example.com", NOW);
        repository.save(late);
        repository.save(early);

        PageResult<User> firstPage = repository.findAll(0, 1);
        PageResult<User> beyond = repository.findAll(5, 1);

        assertThat(firstPage.items()).containsExactly(early);
        assertThat(firstPage.total()).isEqualTo(2);
        assertThat(beyond.items()).isEmpty();
        assertThat(beyond.total()).isEqualTo(2);
    }

    @Test
    void deleteFreesTheEmail() {
        User user = register("alice@example.com", NOW);
        repository.save(user);

        assertThat(repository.delete(user.getId())).isTrue();
        assertThat(repository.delete(user.getId())).isFalse();
        assertThat(repository.findByEmail(Email.of("alice@example.com"))).isEmpty();
    }

    private static User register(String email, OffsetDateTime at) {
        return User.register(new NewUser(email, "Alice", "Smith", null, null, List.of()), null, at);
    }
}
