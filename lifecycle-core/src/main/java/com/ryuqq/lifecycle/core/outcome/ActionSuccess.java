package com.ryuqq.lifecycle.core.outcome;

/**
 * 액션 성공.
 *
 * @param actionName 액션 이름
 * @param elapsedMs 실행 시간 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionSuccess(String actionName, long elapsedMs) implements ActionOutcome {

    public ActionSuccess {
        if (actionName == null || actionName.isBlank()) {
            throw new IllegalArgumentException("actionName cannot be null or blank");
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs cannot be negative (current: " + elapsedMs + ")");
        }
    }

    public static ActionSuccess of(String actionName, long elapsedMs) {
        return new ActionSuccess(actionName, elapsedMs);
    }
}
