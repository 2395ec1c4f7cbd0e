package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.application.phase.OrchestratorPhase;
import com.ryuqq.lifecycle.core.statemachine.FsmInstance;
import com.ryuqq.lifecycle.core.statemachine.TransitionResult;

import java.util.Optional;

/**
 * 여러 FSM 인스턴스의 시작과 종료를 조정하는 오케스트레이터.
 *
 * <p><strong>시작 시퀀스:</strong></p>
 * <ol>
 *   <li>contract_loader: idle → discovering → ready</li>
 *   <li>contract_registry: idle → validating → ready (검증 실패 시 error)</li>
 *   <li>node_graph: initializing → wiring → running</li>
 *   <li>{@code runtime.ready} 발행</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * LifecycleOrchestrator orchestrator = ...;
 * StartupReport report = orchestrator.start();
 *
 * HealthSummary health = orchestrator.health();
 * if (!health.healthy()) {
 *     // 운영자 조치 필요
 * }
 *
 * orchestrator.shutdown();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface LifecycleOrchestrator {

    /**
     * 시작 시퀀스 실행 (완료까지 블로킹).
     *
     * <p>치명 액션 실패나 계약 검증 실패는 시작 시퀀스에 치명적이며,
     * 자동으로 재시도하지 않습니다.</p>
     *
     * @return 시작 결과
     * @throws StartupException 시작에 실패한 경우 (문제 계약/액션 포함)
     * @throws IllegalStateException 이미 시작된 경우
     */
    StartupReport start();

    /**
     * 종료 시퀀스 실행.
     *
     * <p>drain_timeout_ms를 넘겨 블로킹하지 않으며, 여러 번 호출해도 안전합니다.</p>
     *
     * @return 종료 결과
     */
    ShutdownReport shutdown();

    /**
     * 인스턴스에 이벤트 전달.
     *
     * <p>다른 전이가 진행 중이면 제한된 횟수만큼 백오프 후 재시도합니다.
     * 전달 중인 작업은 종료 시 drain 대상입니다.</p>
     *
     * @param instanceName 인스턴스 이름
     * @param event 이벤트 이름
     * @return Committed 또는 NoMatch
     * @throws IllegalArgumentException 인스턴스가 없는 경우
     * @throws com.ryuqq.lifecycle.core.error.InstanceBusyException 재시도 후에도 진행 중인 전이가 있는 경우
     * @throws com.ryuqq.lifecycle.core.error.TransitionAbortedException 치명 액션 실패로 전이가 중단된 경우
     */
    TransitionResult deliver(String instanceName, String event);

    /**
     * 현재 헬스 상태.
     *
     * @return 집계된 헬스 요약
     */
    HealthSummary health();

    OrchestratorPhase phase();

    /**
     * 내장 인스턴스 조회.
     *
     * @param role 역할
     * @return FSM 인스턴스
     */
    FsmInstance instance(InstanceRole role);

    /**
     * 이름으로 인스턴스 조회 (내장 인스턴스 및 노드 인스턴스).
     *
     * @param instanceName 인스턴스 이름
     * @return FSM 인스턴스 (없으면 empty)
     */
    Optional<FsmInstance> instance(String instanceName);
}
