package com.ryuqq.lifecycle.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value store for state snapshots written by {@code persistence} actions.
 *
 * <p>Saving under an existing key replaces the previous snapshot.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * Saves a snapshot.
     *
     * @param key snapshot key
     * @param snapshot snapshot content
     * @throws IllegalArgumentException if key is blank or snapshot is null
     */
    void save(String key, Map<String, Object> snapshot);

    /**
     * Loads the latest snapshot for a key.
     *
     * @param key snapshot key
     * @return snapshot, or empty if none was saved
     */
    Optional<Map<String, Object>> load(String key);
}
