package com.ryuqq.lifecycle.adapter.inmemory.store;

import com.ryuqq.lifecycle.core.spi.DiagnosticStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory write-once implementation of {@link DiagnosticStore} SPI.
 *
 * <p>{@link ConcurrentHashMap#putIfAbsent} makes the first capture for a key win,
 * including under concurrent captures.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDiagnosticStore implements DiagnosticStore {

    private final ConcurrentHashMap<String, Map<String, Object>> diagnostics = new ConcurrentHashMap<>();

    @Override
    public boolean capture(String key, Map<String, Object> diagnostic) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (diagnostic == null) {
            throw new IllegalArgumentException("diagnostic cannot be null");
        }
        return diagnostics.putIfAbsent(key, Collections.unmodifiableMap(new LinkedHashMap<>(diagnostic))) == null;
    }

    @Override
    public Optional<Map<String, Object>> find(String key) {
        return Optional.ofNullable(diagnostics.get(key));
    }

    public int size() {
        return diagnostics.size();
    }

    public void clear() {
        diagnostics.clear();
    }
}
