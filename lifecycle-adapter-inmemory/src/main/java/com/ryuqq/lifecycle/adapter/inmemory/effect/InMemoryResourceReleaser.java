package com.ryuqq.lifecycle.adapter.inmemory.effect;

import com.ryuqq.lifecycle.core.spi.ResourceReleaser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link ResourceReleaser} SPI.
 *
 * <p>Owned handles are registered by name; releasing closes the handle once.
 * Releasing an unknown or already released resource returns false.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * releaser.register("subscription:billing", subscription);
 * releaser.release("subscription:billing"); // true, subscription closed
 * releaser.release("subscription:billing"); // false, no-op
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResourceReleaser implements ResourceReleaser {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResourceReleaser.class);

    private final Map<String, AutoCloseable> owned = new ConcurrentHashMap<>();
    private final List<String> released = new CopyOnWriteArrayList<>();

    @Override
    public void register(String resource, AutoCloseable handle) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        owned.put(resource, handle);
    }

    @Override
    public boolean release(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        AutoCloseable handle = owned.remove(resource);
        if (handle == null) {
            log.debug("Resource {} already released or unknown", resource);
            return false;
        }
        try {
            handle.close();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to release resource " + resource, e);
        }
        released.add(resource);
        return true;
    }

    public boolean isOwned(String resource) {
        return owned.containsKey(resource);
    }

    /**
     * Resources released so far, in release order.
     *
     * @return released resource identifiers
     */
    public List<String> released() {
        return List.copyOf(released);
    }
}
