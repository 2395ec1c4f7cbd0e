package com.ryuqq.lifecycle.adapter.runner;

/**
 * DefaultLifecycleOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>drainTimeoutMs: 종료 시 진행 중 작업 대기 상한 (기본 5000ms)</li>
 *   <li>busyRetryAttempts: Busy 응답 시 최대 시도 횟수 (기본 5, 첫 시도 포함)</li>
 *   <li>busyRetryBaseDelayMs: 재시도 기본 지연 (기본 10ms)</li>
 *   <li>busyRetryMaxDelayMs: 재시도 최대 지연 (기본 200ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param drainTimeoutMs drain 대기 상한 (밀리초, 0 이상)
 * @param busyRetryAttempts 최대 시도 횟수 (1 이상)
 * @param busyRetryBaseDelayMs 기본 지연 (밀리초, 양수)
 * @param busyRetryMaxDelayMs 최대 지연 (밀리초, busyRetryBaseDelayMs 이상)
 */
public record OrchestratorConfig(
    long drainTimeoutMs,
    int busyRetryAttempts,
    long busyRetryBaseDelayMs,
    long busyRetryMaxDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: drainTimeoutMs=5000ms, busyRetryAttempts=5,
     * busyRetryBaseDelayMs=10ms, busyRetryMaxDelayMs=200ms</p>
     */
    public OrchestratorConfig() {
        this(5000, 5, 10, 200);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrchestratorConfig {
        if (drainTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "drainTimeoutMs must not be negative (current: " + drainTimeoutMs + ")"
            );
        }
        if (busyRetryAttempts <= 0) {
            throw new IllegalArgumentException(
                "busyRetryAttempts must be positive (current: " + busyRetryAttempts + ")"
            );
        }
        if (busyRetryBaseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "busyRetryBaseDelayMs must be positive (current: " + busyRetryBaseDelayMs + ")"
            );
        }
        if (busyRetryMaxDelayMs < busyRetryBaseDelayMs) {
            throw new IllegalArgumentException(
                "busyRetryMaxDelayMs must be >= busyRetryBaseDelayMs (base: " + busyRetryBaseDelayMs
                    + ", max: " + busyRetryMaxDelayMs + ")"
            );
        }
    }

    /**
     * drainTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withDrainTimeoutMs(long drainTimeoutMs) {
        return new OrchestratorConfig(drainTimeoutMs, busyRetryAttempts, busyRetryBaseDelayMs, busyRetryMaxDelayMs);
    }

    /**
     * busyRetryAttempts만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withBusyRetryAttempts(int busyRetryAttempts) {
        return new OrchestratorConfig(drainTimeoutMs, busyRetryAttempts, busyRetryBaseDelayMs, busyRetryMaxDelayMs);
    }

    /**
     * 재시도 지연 범위만 변경한 새 인스턴스 생성.
     */
    public OrchestratorConfig withBusyRetryDelays(long busyRetryBaseDelayMs, long busyRetryMaxDelayMs) {
        return new OrchestratorConfig(drainTimeoutMs, busyRetryAttempts, busyRetryBaseDelayMs, busyRetryMaxDelayMs);
    }
}
