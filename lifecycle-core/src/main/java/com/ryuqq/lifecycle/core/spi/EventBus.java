package com.ryuqq.lifecycle.core.spi;

import java.util.Map;

/**
 * Event bus SPI used by {@code event} actions and node graph wiring.
 *
 * <p><strong>Topic naming:</strong></p>
 * <ul>
 *   <li>{@code lifecycle.evt.<node>.v1} - observability tier, readable by any consumer</li>
 *   <li>{@code lifecycle.cmd.<node>.v1} - command tier, access restricted by the bus</li>
 * </ul>
 *
 * <p>The runtime only supplies topic, event name and payload. Topic ACLs are
 * enforced by the bus implementation, never by the engine.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: publish and subscribe may be called from action threads concurrently</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes an event.
     *
     * @param topic destination topic
     * @param eventName event name
     * @param payload event payload (may be empty, never null)
     * @throws IllegalArgumentException if topic or eventName is null or blank
     */
    void publish(String topic, String eventName, Map<String, Object> payload);

    /**
     * Subscribes a consumer to a topic.
     *
     * @param topic topic to subscribe to
     * @param subscriberId consumer identifier
     * @return active subscription handle
     * @throws IllegalArgumentException if topic or subscriberId is null or blank
     */
    Subscription subscribe(String topic, String subscriberId);
}
