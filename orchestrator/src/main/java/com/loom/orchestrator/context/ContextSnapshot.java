package com.loom.orchestrator.context;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable point-in-time view of a {@link ContextStore}.
 *
 * Stages read through a snapshot so that every value they see belongs to
 * one consistent state of the store.
 *
 * @param values       current value per key, in first-write order
 * @param lastSequence sequence number of the last write included in this view (0 when empty)
 */
public record ContextSnapshot(Map<String, String> values, long lastSequence) {

    public ContextSnapshot {
        values = Map.copyOf(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
}
