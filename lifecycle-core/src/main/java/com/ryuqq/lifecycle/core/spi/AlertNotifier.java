package com.ryuqq.lifecycle.core.spi;

import java.util.Map;

/**
 * Paging/alerting endpoint for {@code alert} actions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AlertNotifier {

    /**
     * Raises an alert.
     *
     * @param severity alert severity
     * @param source instance that raised the alert
     * @param message alert message
     * @param details additional context (may be empty, never null)
     */
    void raise(AlertSeverity severity, String source, String message, Map<String, Object> details);
}
