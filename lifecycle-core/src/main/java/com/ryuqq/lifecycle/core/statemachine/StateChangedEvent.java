package com.ryuqq.lifecycle.core.statemachine;

/**
 * 커밋된 전이 알림 ({@code state_changed}).
 *
 * @param instanceName 인스턴스 이름
 * @param fromState 출발 상태
 * @param toState 도착 상태
 * @param generation 커밋 후 generation
 * @param event 전이를 일으킨 이벤트
 * @param correlationId 상관관계 ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateChangedEvent(
    String instanceName,
    String fromState,
    String toState,
    long generation,
    String event,
    String correlationId
) {
}
