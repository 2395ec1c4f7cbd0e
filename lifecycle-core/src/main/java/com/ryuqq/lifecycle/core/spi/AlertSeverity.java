package com.ryuqq.lifecycle.core.spi;

import java.util.Locale;

/**
 * Alert severity for {@code alert} actions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertSeverity {

    INFO,
    WARNING,
    CRITICAL;

    /**
     * Case-insensitive lookup.
     *
     * @param value severity name
     * @return AlertSeverity
     * @throws IllegalArgumentException if value is null or unknown
     */
    public static AlertSeverity from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity cannot be null or blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alert severity: " + value, e);
        }
    }
}
