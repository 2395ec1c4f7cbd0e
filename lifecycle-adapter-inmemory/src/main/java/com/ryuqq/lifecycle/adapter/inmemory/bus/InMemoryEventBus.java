package com.ryuqq.lifecycle.adapter.inmemory.bus;

import com.ryuqq.lifecycle.core.spi.EventBus;
import com.ryuqq.lifecycle.core.spi.Subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of {@link EventBus} SPI for testing and reference purposes.
 *
 * <p>Published events are recorded in publication order; subscriptions are tracked per topic.
 * Nothing is delivered to subscribers: the bus only records what was wired and emitted.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Event Log:</strong> CopyOnWriteArrayList&lt;PublishedEvent&gt; - every publish, in order</li>
 *   <li><strong>Subscriptions:</strong> ConcurrentHashMap&lt;String, List&lt;InMemorySubscription&gt;&gt; - per topic</li>
 *   <li><strong>Availability:</strong> AtomicBoolean - simulates a broker outage for failure tests</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventBus bus = new InMemoryEventBus();
 * Subscription subscription = bus.subscribe("lifecycle.cmd.billing.v1", "billing");
 *
 * bus.publish("lifecycle.evt.runtime.v1", "runtime.ready", Map.of());
 * List&lt;PublishedEvent&gt; events = bus.published("lifecycle.evt.runtime.v1");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private final List<PublishedEvent> events = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, List<InMemorySubscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicBoolean available = new AtomicBoolean(true);

    @Override
    public void publish(String topic, String eventName, Map<String, Object> payload) {
        requireText(topic, "topic");
        requireText(eventName, "eventName");
        if (!available.get()) {
            throw new IllegalStateException("Event bus unavailable, cannot publish " + eventName + " to " + topic);
        }
        events.add(new PublishedEvent(topic, eventName, payload, System.currentTimeMillis()));
    }

    @Override
    public Subscription subscribe(String topic, String subscriberId) {
        requireText(topic, "topic");
        requireText(subscriberId, "subscriberId");
        if (!available.get()) {
            throw new IllegalStateException("Event bus unavailable, cannot subscribe " + subscriberId + " to " + topic);
        }
        InMemorySubscription subscription = new InMemorySubscription(topic, subscriberId);
        subscriptions.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(subscription);
        return subscription;
    }

    /**
     * Simulates a broker outage (publish and subscribe throw while unavailable).
     *
     * @param available false to reject all operations
     */
    public void setAvailable(boolean available) {
        this.available.set(available);
    }

    public List<PublishedEvent> publishedEvents() {
        return new ArrayList<>(events);
    }

    public List<PublishedEvent> published(String topic) {
        return events.stream().filter(e -> e.topic().equals(topic)).toList();
    }

    /**
     * Active subscriber ids for a topic, in subscription order.
     *
     * @param topic topic
     * @return active subscriber ids (empty if none)
     */
    public List<String> activeSubscribers(String topic) {
        return subscriptions.getOrDefault(topic, List.of()).stream()
            .filter(InMemorySubscription::isActive)
            .map(InMemorySubscription::subscriberId)
            .toList();
    }

    /**
     * Active subscriptions grouped by topic.
     *
     * @return topic to active subscriber ids
     */
    public Map<String, List<String>> activeSubscriptions() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        subscriptions.keySet().stream().sorted().forEach(topic -> {
            List<String> active = activeSubscribers(topic);
            if (!active.isEmpty()) {
                result.put(topic, active);
            }
        });
        return result;
    }

    public void clear() {
        events.clear();
        subscriptions.clear();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    private static final class InMemorySubscription implements Subscription {

        private final String topic;
        private final String subscriberId;
        private final AtomicBoolean active = new AtomicBoolean(true);

        InMemorySubscription(String topic, String subscriberId) {
            this.topic = topic;
            this.subscriberId = subscriberId;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public String subscriberId() {
            return subscriberId;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            active.set(false);
        }

        @Override
        public String toString() {
            return "Subscription{" + subscriberId + " -> " + topic + (active.get() ? "" : ", closed") + "}";
        }
    }
}
