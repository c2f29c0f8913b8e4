package com.tutorhub.backend.global.memory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;

import com.tutorhub.backend.global.domain.ConflictException;
import com.tutorhub.backend.global.domain.PageResult;

/**
 * Map-backed store shared by the in-memory repositories. Writes are serialized on the instance
 * and an optional unique key is indexed so duplicates fail the same way the database does.
 * A {@code null} list order keeps insertion order.
 *
 * <p>Aggregates are held by reference, as a persistence context would hold them. A change made to a
 * loaded aggregate is visible through {@code get} before it is saved, and stays visible when the save
 * is rejected; there is no rollback. The unique index only ever holds keys of accepted saves.</p>
 */
public abstract class InMemoryAggregateRepository<T> {

    private final Map<UUID, T> store = new LinkedHashMap<>();
    private final Map<String, UUID> uniqueIndex = new HashMap<>();
    // last indexed key per id; stored aggregates are mutated in place
    private final Map<UUID, String> indexedKeys = new HashMap<>();
    private final Function<T, UUID> idOf;
    private final Function<T, String> uniqueKeyOf;
    private final String uniqueField;
    private final Comparator<T> listOrder;

    protected InMemoryAggregateRepository(
            Function<T, UUID> idOf,
            String uniqueField,
            Function<T, String> uniqueKeyOf,
            Comparator<T> listOrder
    ) {
        this.idOf = idOf;
        this.uniqueField = uniqueField;
        this.uniqueKeyOf = uniqueKeyOf;
        this.listOrder = listOrder;
    }

    protected synchronized void put(T aggregate) {
        UUID id = idOf.apply(aggregate);
        if (uniqueKeyOf != null) {
            String key = uniqueKeyOf.apply(aggregate);
            UUID owner = uniqueIndex.get(key);
            if (owner != null && !owner.equals(id)) {
                throw new ConflictException(uniqueField, uniqueField + " already in use: " + key);
            }
            String previousKey = indexedKeys.put(id, key);
            if (previousKey != null && !previousKey.equals(key)) {
                uniqueIndex.remove(previousKey);
            }
            uniqueIndex.put(key, id);
        }
        store.put(id, aggregate);
    }

    protected synchronized Optional<T> get(UUID id) {
        return Optional.ofNullable(store.get(id));
    }

    protected synchronized Optional<T> getByUniqueKey(String key) {
        UUID id = uniqueIndex.get(key);
        return id == null ? Optional.empty() : Optional.ofNullable(store.get(id));
    }

    protected synchronized PageResult<T> page(int offset, int limit) {
        if (offset < 0 || limit < 1) {
            throw new IllegalArgumentException("offset must be >= 0 and limit >= 1");
        }
        List<T> ordered = new ArrayList<>(store.values());
        if (listOrder != null) {
            ordered.sort(listOrder);
        }
        List<T> items = offset >= ordered.size()
                ? List.of()
                : ordered.subList(offset, Math.min(ordered.size(), offset + limit));
        return new PageResult<>(items, ordered.size(), offset, limit);
    }

    protected synchronized List<T> filter(Predicate<T> predicate, int limit) {
        List<T> matches = new ArrayList<>(store.values().stream().filter(predicate).toList());
        if (listOrder != null) {
            matches.sort(listOrder);
        }
        return matches.size() <= limit ? matches : List.copyOf(matches.subList(0, limit));
    }

    protected synchronized boolean remove(UUID id) {
        T removed = store.remove(id);
        if (removed == null) {
            return false;
        }
        String key = indexedKeys.remove(id);
        if (key != null) {
            uniqueIndex.remove(key);
        }
        return true;
    }

    public synchronized int size() {
        return store.size();
    }
}
