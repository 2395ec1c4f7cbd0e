package com.ryuqq.lifecycle.core.model;

import java.util.List;

/**
 * 계약의 상태 정의.
 *
 * @param name 상태 이름
 * @param initial 초기 상태 여부 (계약당 정확히 하나)
 * @param terminal 종료 상태 여부 (entry 액션은 재실행해도 안전해야 함)
 * @param entryActions 진입 시 실행할 액션 이름 (순서 유지)
 * @param exitActions 이탈 시 실행할 액션 이름 (순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StateDefinition(
    String name,
    boolean initial,
    boolean terminal,
    List<String> entryActions,
    List<String> exitActions
) {

    public StateDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("state_name cannot be null or blank");
        }
        if (TransitionDefinition.WILDCARD.equals(name)) {
            throw new IllegalArgumentException("state_name cannot be the wildcard '*'");
        }
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
        exitActions = exitActions == null ? List.of() : List.copyOf(exitActions);
    }

    public static StateDefinition of(String name) {
        return new StateDefinition(name, false, false, List.of(), List.of());
    }

    public StateDefinition asInitial() {
        return new StateDefinition(name, true, terminal, entryActions, exitActions);
    }

    public StateDefinition asTerminal() {
        return new StateDefinition(name, initial, true, entryActions, exitActions);
    }

    public StateDefinition withEntryActions(String... actionNames) {
        return new StateDefinition(name, initial, terminal, List.of(actionNames), exitActions);
    }

    public StateDefinition withExitActions(String... actionNames) {
        return new StateDefinition(name, initial, terminal, entryActions, List.of(actionNames));
    }
}
