package com.ryuqq.lifecycle.core.spi;

/**
 * Registry of owned handles (sockets, subscriptions, file handles) released by {@code cleanup} actions.
 *
 * <p>The runtime registers handles it opens, for example event bus subscriptions created
 * during wiring; cleanup actions release them by name.</p>
 *
 * <p><strong>Idempotency:</strong> releasing an already released or unknown resource
 * is a no-op and must not throw.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceReleaser {

    /**
     * Registers an owned handle. Registering a name again replaces the previous handle.
     *
     * @param resource resource identifier
     * @param handle handle closed on release
     * @throws IllegalArgumentException if resource is blank or handle is null
     */
    void register(String resource, AutoCloseable handle);

    /**
     * Releases a resource.
     *
     * @param resource resource identifier
     * @return true if this call released the resource, false if there was nothing to release
     * @throws IllegalArgumentException if resource is null or blank
     * @throws IllegalStateException if closing the handle failed
     */
    boolean release(String resource);
}
