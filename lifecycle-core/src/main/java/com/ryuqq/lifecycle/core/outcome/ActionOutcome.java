package com.ryuqq.lifecycle.core.outcome;

/**
 * 단일 액션 실행 결과.
 *
 * <ul>
 *   <li>{@link ActionSuccess}: 기한 내 정상 완료</li>
 *   <li>{@link ActionFailure}: 핸들러 실패, 타임아웃, 인터럽트, 핸들러 없음</li>
 * </ul>
 *
 * <p>타임아웃도 {@link ActionFailure}입니다. 치명 여부는 결과가 아니라
 * 액션 정의의 {@code critical} 플래그로 판단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ActionOutcome permits ActionSuccess, ActionFailure {

    /**
     * 실행한 액션 이름.
     *
     * @return 액션 이름
     */
    String actionName();

    default boolean isSuccess() {
        return this instanceof ActionSuccess;
    }

    default boolean isFailure() {
        return this instanceof ActionFailure;
    }
}
