package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.executor.ActionPhase;
import com.ryuqq.lifecycle.core.outcome.ActionOutcome;

/**
 * 전이 중 실행된 액션 한 건의 기록.
 *
 * @param phase 실행 단계
 * @param actionName 액션 이름
 * @param critical 실행 시점의 치명 여부
 * @param outcome 실행 결과
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionRecord(
    ActionPhase phase,
    String actionName,
    boolean critical,
    ActionOutcome outcome
) {

    public ActionRecord {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (actionName == null || actionName.isBlank()) {
            throw new IllegalArgumentException("actionName cannot be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
    }

    public boolean failed() {
        return outcome.isFailure();
    }
}
