package com.ryuqq.lifecycle.adapter.inmemory.effect;

import com.ryuqq.lifecycle.core.spi.AlertNotifier;
import com.ryuqq.lifecycle.core.spi.AlertSeverity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link AlertNotifier} SPI.
 *
 * <p>Records raised alerts and mirrors them to the log at a level matching the severity.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAlertNotifier.class);

    private final List<RaisedAlert> alerts = new CopyOnWriteArrayList<>();

    @Override
    public void raise(AlertSeverity severity, String source, String message, Map<String, Object> details) {
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        alerts.add(new RaisedAlert(severity, source, message,
            details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details))));

        switch (severity) {
            case CRITICAL -> log.error("[ALERT {}] {}: {}", severity, source, message);
            case WARNING -> log.warn("[ALERT {}] {}: {}", severity, source, message);
            case INFO -> log.info("[ALERT {}] {}: {}", severity, source, message);
        }
    }

    public List<RaisedAlert> alerts() {
        return new ArrayList<>(alerts);
    }

    public void clear() {
        alerts.clear();
    }

    /**
     * 기록된 알림.
     *
     * @param severity 심각도
     * @param source 발생 인스턴스
     * @param message 메시지
     * @param details 추가 정보
     */
    public record RaisedAlert(AlertSeverity severity, String source, String message, Map<String, Object> details) {
    }
}
