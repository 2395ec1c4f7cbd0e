package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common payload fields shared by all default handlers.
 */
final class ActionPayloads {

    private ActionPayloads() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Map<String, Object> of(ActionDefinition action, ActionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instance", context.instanceName());
        payload.put("node_type", context.nodeType().name());
        payload.put("action", action.name());
        payload.put("phase", context.phase().name());
        payload.put("event", context.event());
        payload.put("from_state", context.sourceState());
        payload.put("to_state", context.targetState());
        payload.put("generation", context.generation());
        payload.put("correlation_id", context.correlationId());
        return payload;
    }
}
