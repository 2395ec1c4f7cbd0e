package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.ContractVersion;
import com.ryuqq.lifecycle.core.model.NodeType;

/**
 * FSM 인스턴스의 시점 스냅샷 (읽기 전용).
 *
 * @param instanceName 인스턴스 이름
 * @param nodeType 노드 종류
 * @param contractVersion 계약 버전
 * @param currentState 현재 상태
 * @param generation 커밋된 전이 수
 * @param terminal 현재 상태가 종료 상태인지 여부
 * @param inTransition 전이 진행 중 여부
 * @param lastResult 마지막 전이 결과 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record InstanceSnapshot(
    String instanceName,
    NodeType nodeType,
    ContractVersion contractVersion,
    String currentState,
    long generation,
    boolean terminal,
    boolean inTransition,
    TransitionResult lastResult
) {
}
