package com.ryuqq.lifecycle.core.executor;

import com.ryuqq.lifecycle.core.model.NodeType;

/**
 * 액션 실행 컨텍스트.
 *
 * <p>전이를 일으킨 이벤트와 출발/도착 상태, 관측용 상관관계 ID를 핸들러까지 전달합니다.</p>
 *
 * @param instanceName FSM 인스턴스 이름
 * @param nodeType 인스턴스 계약의 노드 종류
 * @param event 전이를 일으킨 이벤트
 * @param sourceState 출발 상태
 * @param targetState 도착 상태
 * @param correlationId 상관관계 ID
 * @param generation 전이 시작 시점의 generation
 * @param phase 실행 단계
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionContext(
    String instanceName,
    NodeType nodeType,
    String event,
    String sourceState,
    String targetState,
    String correlationId,
    long generation,
    ActionPhase phase
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public ActionContext {
        if (instanceName == null || instanceName.isBlank()) {
            throw new IllegalArgumentException("instanceName cannot be null or blank");
        }
        if (nodeType == null) {
            throw new IllegalArgumentException("nodeType cannot be null");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        if (sourceState == null || targetState == null) {
            throw new IllegalArgumentException("sourceState and targetState cannot be null");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
    }

    /**
     * 다른 단계로 복사.
     *
     * @param phase 새 단계
     * @return 단계만 바뀐 ActionContext
     */
    public ActionContext withPhase(ActionPhase phase) {
        return new ActionContext(instanceName, nodeType, event, sourceState, targetState,
            correlationId, generation, phase);
    }
}
