package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.spi.SnapshotStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link SnapshotStore} SPI.
 *
 * <p>Latest snapshot per key wins. A write counter is kept so tests can tell a
 * repeated save from a single one.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<String, Map<String, Object>> snapshots = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public void save(String key, Map<String, Object> snapshot) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        snapshots.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(snapshot)));
        writes.incrementAndGet();
    }

    @Override
    public Optional<Map<String, Object>> load(String key) {
        return Optional.ofNullable(snapshots.get(key));
    }

    public int size() {
        return snapshots.size();
    }

    public int writeCount() {
        return writes.get();
    }

    public void clear() {
        snapshots.clear();
        writes.set(0);
    }
}
