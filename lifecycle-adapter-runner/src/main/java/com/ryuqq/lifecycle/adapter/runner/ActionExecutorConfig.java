package com.ryuqq.lifecycle.adapter.runner;

/**
 * TimedActionExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: 액션 실행 스레드 이름 접두사 (기본 "lifecycle-action-")</li>
 *   <li>maxConcurrentActions: 동시에 실행 가능한 액션 수 (기본 8)</li>
 * </ul>
 *
 * <p>인스턴스 하나는 한 번에 하나의 액션만 실행하므로, maxConcurrentActions는
 * 동시에 전이할 수 있는 인스턴스 수의 상한입니다. 타임아웃으로 중단 요청된 액션이
 * 인터럽트에 응답하지 않으면 스레드를 계속 점유합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param threadNamePrefix 스레드 이름 접두사 (blank 불가)
 * @param maxConcurrentActions 최대 동시 액션 수 (1 이상)
 */
public record ActionExecutorConfig(String threadNamePrefix, int maxConcurrentActions) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: threadNamePrefix="lifecycle-action-", maxConcurrentActions=8</p>
     */
    public ActionExecutorConfig() {
        this("lifecycle-action-", 8);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ActionExecutorConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (maxConcurrentActions <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentActions must be positive (current: " + maxConcurrentActions + ")"
            );
        }
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public ActionExecutorConfig withThreadNamePrefix(String threadNamePrefix) {
        return new ActionExecutorConfig(threadNamePrefix, maxConcurrentActions);
    }

    /**
     * maxConcurrentActions만 변경한 새 인스턴스 생성.
     */
    public ActionExecutorConfig withMaxConcurrentActions(int maxConcurrentActions) {
        return new ActionExecutorConfig(threadNamePrefix, maxConcurrentActions);
    }
}
