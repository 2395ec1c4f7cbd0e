package com.ryuqq.lifecycle.core.executor;

import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.outcome.ActionOutcome;

/**
 * 단일 액션 실행자.
 *
 * <p>액션의 부수 효과를 {@code timeout_ms} 기한 안에서 실행하고 결과를 분류합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>기한 내 완료: 효과의 결과에 따라 Success 또는 Failure</li>
 *   <li>기한 경과: Failure(ACTION_TIMEOUT), 보고된 실패와 동일하게 취급</li>
 *   <li>재시도하지 않음 (재시도는 액션 구현의 책임)</li>
 *   <li>예외를 던지지 않음, 모든 실패는 {@link ActionOutcome}으로 반환</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.
 * 서로 다른 인스턴스의 전이가 동시에 호출할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ActionExecutor {

    /**
     * 액션 실행 (기한까지 블로킹).
     *
     * @param action 실행할 액션 정의
     * @param context 실행 컨텍스트
     * @return 실행 결과 (null 아님)
     * @throws IllegalArgumentException action 또는 context가 null인 경우
     */
    ActionOutcome execute(ActionDefinition action, ActionContext context);
}
