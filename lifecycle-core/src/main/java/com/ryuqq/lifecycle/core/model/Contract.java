package com.ryuqq.lifecycle.core.model;

import com.ryuqq.lifecycle.core.error.SchemaException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 로드된 계약 (불변).
 *
 * <p>상태, 전이, 액션 정의를 보관하며 전이 엔진이 해석하는 데이터입니다.
 * 재로드는 새 Contract 값을 만들며, 기존 값을 수정하지 않습니다.</p>
 *
 * <p><strong>전이 조회 규칙:</strong></p>
 * <ol>
 *   <li>(현재 상태, 이벤트)로 정확한 전이 조회</li>
 *   <li>없으면 이벤트 이름만으로 와일드카드 전이 조회</li>
 *   <li>종료 상태에서는 와일드카드 전이가 적용되지 않음</li>
 * </ol>
 *
 * <p>생성은 {@link #builder(NodeType, ContractVersion)}로만 가능하며,
 * {@link Builder#build()}가 모든 불변식을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Contract {

    private final NodeType nodeType;
    private final ContractVersion version;
    private final String nodeName;
    private final String description;
    private final Map<String, StateDefinition> states;
    private final List<TransitionDefinition> transitions;
    private final Map<String, ActionDefinition> actions;
    private final List<NodeDependency> dependencies;
    private final String initialState;
    private final Map<String, Map<String, TransitionDefinition>> exactTransitions;
    private final Map<String, TransitionDefinition> wildcardTransitions;

    private Contract(Builder builder) {
        this.nodeType = builder.nodeType;
        this.version = builder.version;
        this.nodeName = builder.nodeName;
        this.description = builder.description;

        Map<String, StateDefinition> stateMap = new LinkedHashMap<>();
        String initial = null;
        for (StateDefinition state : builder.states) {
            stateMap.put(state.name(), state);
            if (state.initial()) {
                initial = state.name();
            }
        }
        this.states = Collections.unmodifiableMap(stateMap);
        this.initialState = initial;

        Map<String, ActionDefinition> actionMap = new LinkedHashMap<>();
        for (ActionDefinition action : builder.actions) {
            actionMap.put(action.name(), action);
        }
        this.actions = Collections.unmodifiableMap(actionMap);

        this.transitions = List.copyOf(builder.transitions);
        this.dependencies = List.copyOf(builder.dependencies);

        Map<String, Map<String, TransitionDefinition>> exact = new HashMap<>();
        Map<String, TransitionDefinition> wildcard = new HashMap<>();
        for (TransitionDefinition transition : transitions) {
            if (transition.isWildcard()) {
                wildcard.put(transition.trigger(), transition);
            } else {
                exact.computeIfAbsent(transition.fromState(), k -> new HashMap<>())
                    .put(transition.trigger(), transition);
            }
        }
        exact.replaceAll((state, byEvent) -> Collections.unmodifiableMap(byEvent));
        this.exactTransitions = Collections.unmodifiableMap(exact);
        this.wildcardTransitions = Collections.unmodifiableMap(wildcard);
    }

    /**
     * Builder 생성.
     *
     * @param nodeType 노드 종류
     * @param version 계약 버전
     * @return Builder
     */
    public static Builder builder(NodeType nodeType, ContractVersion version) {
        return new Builder(nodeType, version);
    }

    /**
     * 현재 상태와 이벤트에 적용할 전이 조회.
     *
     * @param currentState 현재 상태 이름
     * @param event 이벤트 이름
     * @return 적용할 전이 (없으면 empty)
     * @throws IllegalArgumentException currentState가 계약에 없는 상태인 경우
     */
    public Optional<TransitionDefinition> findTransition(String currentState, String event) {
        StateDefinition state = state(currentState);
        TransitionDefinition exact = exactTransitions.getOrDefault(currentState, Map.of()).get(event);
        if (exact != null) {
            return Optional.of(exact);
        }
        // 종료 상태는 와일드카드 경로에 대해 흡수 상태
        if (state.terminal()) {
            return Optional.empty();
        }
        return Optional.ofNullable(wildcardTransitions.get(event));
    }

    /**
     * 이 계약이 어떤 상태에서든 해당 이벤트를 처리하는지 확인.
     *
     * @param event 이벤트 이름
     * @return 해당 trigger를 가진 전이가 하나라도 있으면 true
     */
    public boolean handles(String event) {
        return transitions.stream().anyMatch(t -> t.trigger().equals(event));
    }

    /**
     * 상태 정의 조회.
     *
     * @param name 상태 이름
     * @return StateDefinition
     * @throws IllegalArgumentException 선언되지 않은 상태인 경우
     */
    public StateDefinition state(String name) {
        StateDefinition state = states.get(name);
        if (state == null) {
            throw new IllegalArgumentException("Unknown state '" + name + "' in contract " + nodeName);
        }
        return state;
    }

    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    public boolean isTerminal(String stateName) {
        return state(stateName).terminal();
    }

    /**
     * 액션 정의 조회.
     *
     * @param name 액션 이름
     * @return ActionDefinition
     * @throws IllegalArgumentException 정의되지 않은 액션인 경우
     */
    public ActionDefinition action(String name) {
        ActionDefinition action = actions.get(name);
        if (action == null) {
            throw new IllegalArgumentException("Unknown action '" + name + "' in contract " + nodeName);
        }
        return action;
    }

    /**
     * 액션 이름 목록을 정의 목록으로 변환 (순서 유지).
     *
     * @param names 액션 이름 목록
     * @return ActionDefinition 목록
     */
    public List<ActionDefinition> resolveActions(List<String> names) {
        List<ActionDefinition> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            resolved.add(action(name));
        }
        return resolved;
    }

    public NodeType nodeType() {
        return nodeType;
    }

    public ContractVersion version() {
        return version;
    }

    public String nodeName() {
        return nodeName;
    }

    public String description() {
        return description;
    }

    public String initialState() {
        return initialState;
    }

    public Map<String, StateDefinition> states() {
        return states;
    }

    public List<TransitionDefinition> transitions() {
        return transitions;
    }

    public Map<String, ActionDefinition> actions() {
        return actions;
    }

    public List<NodeDependency> dependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return "Contract{" + nodeName + " " + nodeType + " v" + version
            + ", states=" + states.keySet() + ", transitions=" + transitions.size() + "}";
    }

    /**
     * Contract Builder.
     *
     * <p>선언 순서를 유지하며, {@link #build()} 시 교차 참조를 포함한 전체 검증을 수행합니다.</p>
     */
    public static final class Builder {

        private final NodeType nodeType;
        private final ContractVersion version;
        private String nodeName;
        private String description;
        private final List<StateDefinition> states = new ArrayList<>();
        private final List<TransitionDefinition> transitions = new ArrayList<>();
        private final List<ActionDefinition> actions = new ArrayList<>();
        private final List<NodeDependency> dependencies = new ArrayList<>();

        private Builder(NodeType nodeType, ContractVersion version) {
            if (nodeType == null) {
                throw new IllegalArgumentException("nodeType cannot be null");
            }
            if (version == null) {
                throw new IllegalArgumentException("version cannot be null");
            }
            this.nodeType = nodeType;
            this.version = version;
            this.nodeName = nodeType.name().toLowerCase(Locale.ROOT);
        }

        public Builder nodeName(String nodeName) {
            if (nodeName != null && !nodeName.isBlank()) {
                this.nodeName = nodeName;
            }
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder state(StateDefinition state) {
            states.add(state);
            return this;
        }

        public Builder transition(TransitionDefinition transition) {
            transitions.add(transition);
            return this;
        }

        public Builder action(ActionDefinition action) {
            actions.add(action);
            return this;
        }

        public Builder dependency(NodeDependency dependency) {
            dependencies.add(dependency);
            return this;
        }

        /**
         * 검증 후 Contract 생성.
         *
         * @return 불변 Contract
         * @throws SchemaException 하나 이상의 불변식이 위반된 경우
         */
        public Contract build() {
            List<String> violations = ContractValidator.validate(version, states, transitions, actions, dependencies);
            if (!violations.isEmpty()) {
                throw new SchemaException(nodeName, violations);
            }
            return new Contract(this);
        }
    }
}
