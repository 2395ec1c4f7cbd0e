package com.ryuqq.lifecycle.core.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Write-once diagnostic store for {@code data_capture} actions.
 *
 * <p>The first capture for a key wins; later captures with the same key are no-ops.
 * This keeps terminal-state re-entry free of duplicate diagnostics.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DiagnosticStore {

    /**
     * Captures a diagnostic if the key is not yet present.
     *
     * @param key diagnostic key
     * @param diagnostic diagnostic content
     * @return true if written, false if the key already existed
     * @throws IllegalArgumentException if key is blank or diagnostic is null
     */
    boolean capture(String key, Map<String, Object> diagnostic);

    Optional<Map<String, Object>> find(String key);
}
