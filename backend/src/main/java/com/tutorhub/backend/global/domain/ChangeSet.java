package com.tutorhub.backend.global.domain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Ordered record of the fields a partial update actually changed.
 */
public final class ChangeSet {

    private final Map<String, Object> changes = new LinkedHashMap<>();

    /**
     * Applies {@code proposed} through {@code setter} when it is provided and differs from {@code current}.
     */
    public <T> void apply(String field, T current, T proposed, Consumer<T> setter) {
        if (proposed == null || Objects.equals(current, proposed)) {
            return;
        }
        setter.accept(proposed);
        changes.put(field, proposed);
    }

    /**
     * Records a change the caller already applied. {@code value} may be {@code null} for a cleared field.
     */
    public void record(String field, Object value) {
        changes.put(field, value);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public List<String> fields() {
        return List.copyOf(changes.keySet());
    }

    public Map<String, Object> toPayload(UUID actorId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("changedFields", fields());
        payload.put("changes", new LinkedHashMap<>(changes));
        if (actorId != null) {
            payload.put("actorId", actorId.toString());
        }
        return payload;
    }
}
