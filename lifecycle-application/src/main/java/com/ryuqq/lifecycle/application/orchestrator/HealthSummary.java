package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.application.phase.OrchestratorPhase;
import com.ryuqq.lifecycle.core.statemachine.InstanceSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * 외부 헬스체크 엔드포인트용 집계 상태.
 *
 * <p>healthy는 단계가 RUNNING이고 종료 상태에 있는 인스턴스가 없을 때만 true입니다.</p>
 *
 * @param phase 오케스트레이터 단계
 * @param healthy 정상 여부
 * @param instances 인스턴스별 스냅샷
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HealthSummary(OrchestratorPhase phase, boolean healthy, List<InstanceSnapshot> instances) {

    public HealthSummary {
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        instances = instances == null ? List.of() : List.copyOf(instances);
    }

    /**
     * 스냅샷으로부터 healthy를 계산해 생성.
     *
     * @param phase 오케스트레이터 단계
     * @param instances 인스턴스별 스냅샷
     * @return HealthSummary
     */
    public static HealthSummary of(OrchestratorPhase phase, List<InstanceSnapshot> instances) {
        boolean healthy = phase == OrchestratorPhase.RUNNING
            && instances.stream().noneMatch(InstanceSnapshot::terminal);
        return new HealthSummary(phase, healthy, instances);
    }

    public Optional<InstanceSnapshot> instance(String instanceName) {
        return instances.stream().filter(s -> s.instanceName().equals(instanceName)).findFirst();
    }
}
