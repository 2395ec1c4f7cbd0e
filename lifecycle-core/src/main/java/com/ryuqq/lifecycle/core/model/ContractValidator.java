package com.ryuqq.lifecycle.core.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 계약 불변식 검증 (순수 함수, 부수 효과 없음).
 *
 * <p>위반 사항을 모두 수집해서 반환하며, 예외는 {@link Contract.Builder}가 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class ContractValidator {

    private ContractValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static List<String> validate(ContractVersion version,
                                 List<StateDefinition> states,
                                 List<TransitionDefinition> transitions,
                                 List<ActionDefinition> actions,
                                 List<NodeDependency> dependencies) {
        List<String> violations = new ArrayList<>();

        Map<String, ActionDefinition> actionsByName = validateActions(version, actions, violations);
        Set<String> stateNames = validateStates(states, actionsByName.keySet(), violations);
        validateTransitions(transitions, stateNames, actionsByName.keySet(), violations);
        validateDependencies(dependencies, violations);

        return violations;
    }

    private static Map<String, ActionDefinition> validateActions(ContractVersion version,
                                                                 List<ActionDefinition> actions,
                                                                 List<String> violations) {
        Map<String, ActionDefinition> byName = new HashMap<>();
        for (ActionDefinition action : actions) {
            if (byName.putIfAbsent(action.name(), action) != null) {
                violations.add("duplicate action definition '" + action.name() + "'");
            }
            if (action.version().major() > version.major()) {
                violations.add(String.format("action '%s' version %s is newer than contract version %s",
                    action.name(), action.version(), version));
            }
        }
        for (ActionDefinition action : actions) {
            if (!action.hasRollback()) {
                continue;
            }
            if (action.rollbackAction().equals(action.name())) {
                violations.add("action '" + action.name() + "' cannot be its own rollback_action");
            } else if (!byName.containsKey(action.rollbackAction())) {
                violations.add(String.format("action '%s' references undeclared rollback_action '%s'",
                    action.name(), action.rollbackAction()));
            }
        }
        return byName;
    }

    private static Set<String> validateStates(List<StateDefinition> states,
                                              Set<String> actionNames,
                                              List<String> violations) {
        Set<String> names = new HashSet<>();
        if (states.isEmpty()) {
            violations.add("contract must declare at least one state");
            return names;
        }

        int initialCount = 0;
        int terminalCount = 0;
        for (StateDefinition state : states) {
            if (!names.add(state.name())) {
                violations.add("duplicate state '" + state.name() + "'");
            }
            if (state.initial()) {
                initialCount++;
            }
            if (state.terminal()) {
                terminalCount++;
            }
            checkActionList("entry_actions of state '" + state.name() + "'", state.entryActions(), actionNames, violations);
            checkActionList("exit_actions of state '" + state.name() + "'", state.exitActions(), actionNames, violations);
        }

        if (initialCount != 1) {
            violations.add("contract must declare exactly one initial state (found " + initialCount + ")");
        }
        if (terminalCount == 0) {
            violations.add("contract must declare at least one terminal state");
        }
        return names;
    }

    private static void validateTransitions(List<TransitionDefinition> transitions,
                                            Set<String> stateNames,
                                            Set<String> actionNames,
                                            List<String> violations) {
        Set<String> seen = new HashSet<>();
        for (TransitionDefinition transition : transitions) {
            if (!transition.isWildcard() && !stateNames.contains(transition.fromState())) {
                violations.add(String.format("transition '%s' references undeclared from_state '%s'",
                    transition.name(), transition.fromState()));
            }
            if (TransitionDefinition.WILDCARD.equals(transition.toState())) {
                violations.add("transition '" + transition.name() + "' cannot target the wildcard");
            } else if (!stateNames.contains(transition.toState())) {
                violations.add(String.format("transition '%s' references undeclared to_state '%s'",
                    transition.name(), transition.toState()));
            }
            if (!seen.add(transition.fromState() + "\u0000" + transition.trigger())) {
                violations.add(String.format("ambiguous transitions for (from_state=%s, trigger=%s)",
                    transition.fromState(), transition.trigger()));
            }
            checkActionList("actions of transition '" + transition.name() + "'", transition.actions(), actionNames, violations);
        }
    }

    private static void validateDependencies(List<NodeDependency> dependencies, List<String> violations) {
        Set<String> names = new HashSet<>();
        for (NodeDependency dependency : dependencies) {
            if (!names.add(dependency.nodeName())) {
                violations.add("duplicate dependency on node '" + dependency.nodeName() + "'");
            }
        }
    }

    private static void checkActionList(String owner,
                                        List<String> names,
                                        Set<String> actionNames,
                                        List<String> violations) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                violations.add("duplicate action '" + name + "' in " + owner);
            }
            if (!actionNames.contains(name)) {
                violations.add("undeclared action '" + name + "' referenced by " + owner);
            }
        }
    }
}
