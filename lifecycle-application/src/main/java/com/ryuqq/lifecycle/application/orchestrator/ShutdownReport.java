package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.core.statemachine.InstanceSnapshot;

import java.util.List;

/**
 * 종료 시퀀스 결과.
 *
 * <p>드레인이 drain_timeout_ms 안에 끝나지 않아도 종료는 진행되며,
 * 그 사실은 {@code drained=false}와 비치명 실패로 기록됩니다.</p>
 *
 * @param drained 진행 중 작업이 기한 내에 모두 끝났는지 여부
 * @param drainWaitMs 드레인 대기 시간 (밀리초)
 * @param nonCriticalFailures 종료 중 기록된 비치명 실패
 * @param finalStates 종료 후 인스턴스별 스냅샷
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ShutdownReport(
    boolean drained,
    long drainWaitMs,
    List<String> nonCriticalFailures,
    List<InstanceSnapshot> finalStates
) {

    public ShutdownReport {
        nonCriticalFailures = List.copyOf(nonCriticalFailures);
        finalStates = List.copyOf(finalStates);
    }
}
