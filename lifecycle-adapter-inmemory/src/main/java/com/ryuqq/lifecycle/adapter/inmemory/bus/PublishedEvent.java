package com.ryuqq.lifecycle.adapter.inmemory.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link InMemoryEventBus}에 발행된 이벤트 기록.
 *
 * @param topic 토픽
 * @param eventName 이벤트 이름
 * @param payload 페이로드
 * @param publishedAt 발행 시각 (epoch millis)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PublishedEvent(String topic, String eventName, Map<String, Object> payload, long publishedAt) {

    public PublishedEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
