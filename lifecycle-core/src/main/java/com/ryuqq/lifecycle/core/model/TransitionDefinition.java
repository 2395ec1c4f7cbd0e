package com.ryuqq.lifecycle.core.model;

import java.util.List;

/**
 * 계약의 전이 정의.
 *
 * <p>fromState가 {@value #WILDCARD}이면 "현재 어떤 상태든"을 의미하며,
 * 같은 이벤트에 대한 정확한(exact) 전이가 없을 때만 적용됩니다.</p>
 *
 * @param name 전이 이름 (null이면 from/to/trigger로 생성)
 * @param fromState 출발 상태 이름 또는 와일드카드
 * @param toState 도착 상태 이름 (와일드카드 불가)
 * @param trigger 전이를 일으키는 이벤트 이름
 * @param actions 전이 수준 액션 이름 (순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransitionDefinition(
    String name,
    String fromState,
    String toState,
    String trigger,
    List<String> actions
) {

    public static final String WILDCARD = "*";

    public TransitionDefinition {
        if (fromState == null || fromState.isBlank()) {
            throw new IllegalArgumentException("from_state cannot be null or blank");
        }
        if (toState == null || toState.isBlank()) {
            throw new IllegalArgumentException("to_state cannot be null or blank");
        }
        if (trigger == null || trigger.isBlank()) {
            throw new IllegalArgumentException("trigger cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = fromState + "--" + trigger + "->" + toState;
        }
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * 액션 없는 전이 생성.
     *
     * @param fromState 출발 상태 (또는 "*")
     * @param trigger 이벤트 이름
     * @param toState 도착 상태
     * @return TransitionDefinition
     */
    public static TransitionDefinition of(String fromState, String trigger, String toState) {
        return new TransitionDefinition(null, fromState, toState, trigger, List.of());
    }

    public boolean isWildcard() {
        return WILDCARD.equals(fromState);
    }

    public TransitionDefinition withActions(String... actionNames) {
        return new TransitionDefinition(name, fromState, toState, trigger, List.of(actionNames));
    }
}
