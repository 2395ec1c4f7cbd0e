package com.ryuqq.lifecycle.application.phase;

/**
 * 오케스트레이터 자체의 생명주기 단계.
 *
 * <p><strong>단계 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (start)
 * STARTING ──────────┐
 *    │               │
 *    ▼ (runtime.ready)
 * RUNNING ───────────┤
 *    │               ▼
 *    ▼ (shutdown)  FAILED
 * SHUTTING_DOWN
 *    │
 *    ▼
 * STOPPED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OrchestratorPhase {

    /**
     * 생성됨 (아직 시작 안 됨).
     */
    CREATED,

    /**
     * 시작 시퀀스 진행 중.
     */
    STARTING,

    /**
     * 모든 인스턴스 준비 완료.
     */
    RUNNING,

    /**
     * 드레인 및 종료 진행 중.
     */
    SHUTTING_DOWN,

    /**
     * 정상 종료.
     */
    STOPPED,

    /**
     * 시작 실패 또는 치명 오류.
     */
    FAILED;

    /**
     * 종료 단계인지 확인.
     *
     * @return STOPPED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
