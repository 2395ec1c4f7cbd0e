package com.ryuqq.lifecycle.core.executor;

/**
 * 전이 안에서 액션이 실행되는 단계.
 *
 * <p>정상 실행 순서는 EXIT → TRANSITION → ENTRY이며, ROLLBACK은 중단 시에만 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ActionPhase {

    /** 출발 상태의 exit_actions */
    EXIT,

    /** 전이 자체의 actions */
    TRANSITION,

    /** 도착 상태의 entry_actions */
    ENTRY,

    /** 중단 후 보상 액션 */
    ROLLBACK
}
