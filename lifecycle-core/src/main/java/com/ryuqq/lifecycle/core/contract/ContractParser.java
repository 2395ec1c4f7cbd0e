package com.ryuqq.lifecycle.core.contract;

import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.ContractVersion;
import com.ryuqq.lifecycle.core.model.NodeDependency;
import com.ryuqq.lifecycle.core.model.NodeType;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 원시 계약 문서를 타입이 있는 {@link Contract}로 변환.
 *
 * <p><strong>처리 단계:</strong></p>
 * <ol>
 *   <li>필드 단위 검증 (필수 필드, node_type, semver, 타입)</li>
 *   <li>필드 위반이 있으면 모아서 {@link SchemaException}</li>
 *   <li>{@link Contract.Builder#build()}로 교차 참조 검증</li>
 * </ol>
 *
 * <p>순수 함수이며 파일 시스템이나 네트워크에 접근하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContractParser {

    private ContractParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 문서 파싱.
     *
     * @param document 원시 계약 문서
     * @return 검증된 Contract
     * @throws IllegalArgumentException document가 null인 경우
     * @throws SchemaException 검증 실패 시
     */
    public static Contract parse(ContractDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        return parse(document.sourceId(), document.content());
    }

    /**
     * 출처와 내용으로 파싱.
     *
     * @param source 문서 출처 (오류 메시지에 사용)
     * @param content 문서 내용
     * @return 검증된 Contract
     * @throws SchemaException 검증 실패 시
     */
    public static Contract parse(String source, Map<String, Object> content) {
        if (content == null) {
            throw new SchemaException(source, "document is empty");
        }
        Fields root = new Fields("contract", flatten(content));

        NodeType nodeType = null;
        String rawNodeType = root.requiredString("node_type");
        if (rawNodeType != null) {
            try {
                nodeType = NodeType.from(rawNodeType);
            } catch (IllegalArgumentException e) {
                root.violation("node_type '" + rawNodeType + "' is not one of " + List.of(NodeType.values()));
            }
        }
        ContractVersion version = root.requiredVersion("contract_version");

        List<ActionDefinition> actions = new ArrayList<>();
        for (Fields action : root.objectList("actions", false)) {
            ActionDefinition parsed = parseAction(action, version);
            if (parsed != null) {
                actions.add(parsed);
            }
        }

        String initialState = root.optionalString("initial_state");
        List<StateDefinition> states = new ArrayList<>();
        for (Fields state : root.objectList("states", true)) {
            StateDefinition parsed = parseState(state, initialState);
            if (parsed != null) {
                states.add(parsed);
            }
        }

        List<TransitionDefinition> transitions = new ArrayList<>();
        for (Fields transition : root.objectList("transitions", false)) {
            TransitionDefinition parsed = parseTransition(transition);
            if (parsed != null) {
                transitions.add(parsed);
            }
        }

        List<NodeDependency> dependencies = new ArrayList<>();
        for (Fields dependency : root.objectList("dependencies", false)) {
            String name = dependency.requiredString("node_name");
            ContractVersion required = dependency.requiredVersion("version");
            if (name != null && required != null) {
                dependencies.add(new NodeDependency(name, required));
            }
        }

        if (!root.violations.isEmpty()) {
            throw new SchemaException(source, root.violations);
        }

        Contract.Builder builder = Contract.builder(nodeType, version)
            .nodeName(root.optionalString("node_name"))
            .description(root.optionalString("description"));
        states.forEach(builder::state);
        transitions.forEach(builder::transition);
        actions.forEach(builder::action);
        dependencies.forEach(builder::dependency);

        try {
            return builder.build();
        } catch (SchemaException e) {
            throw e.withSource(source);
        }
    }

    /**
     * {@code state_transitions} 블록과 {@code metadata.description}을 최상위로 끌어올림.
     * 최상위에 같은 키가 있으면 최상위 값이 우선합니다.
     */
    private static Map<String, Object> flatten(Map<String, Object> content) {
        Map<String, Object> flat = new LinkedHashMap<>(content);
        if (content.get("state_transitions") instanceof Map<?, ?> block) {
            block.forEach((k, v) -> flat.putIfAbsent(String.valueOf(k), v));
        }
        if (content.get("metadata") instanceof Map<?, ?> metadata && metadata.get("description") != null) {
            flat.putIfAbsent("description", metadata.get("description"));
        }
        return flat;
    }

    private static ActionDefinition parseAction(Fields action, ContractVersion contractVersion) {
        String name = action.requiredString("action_name");
        String rawType = action.requiredString("action_type");
        ActionType type = null;
        if (rawType != null) {
            try {
                type = ActionType.from(rawType);
            } catch (IllegalArgumentException e) {
                action.violation("action '" + name + "' has unknown action_type '" + rawType + "'");
            }
        }
        boolean critical = action.optionalBoolean("is_critical", false);
        long timeoutMs = action.optionalLong("timeout_ms", ActionDefinition.DEFAULT_TIMEOUT_MS);
        if (timeoutMs <= 0) {
            action.violation("action '" + name + "' timeout_ms must be positive (current: " + timeoutMs + ")");
        }
        ContractVersion version = action.optionalVersion("version", contractVersion);
        String rollback = action.optionalString("rollback_action");
        Map<String, Object> config = action.optionalMap("action_config");

        if (name == null || type == null || timeoutMs <= 0 || version == null) {
            return null;
        }
        return new ActionDefinition(name, type, critical, timeoutMs, version, rollback, config);
    }

    private static StateDefinition parseState(Fields state, String initialState) {
        String name = state.requiredString("state_name");
        if (name == null) {
            return null;
        }
        if (TransitionDefinition.WILDCARD.equals(name)) {
            state.violation("state_name cannot be the wildcard '*'");
            return null;
        }
        boolean initial = state.optionalBoolean("is_initial", false) || name.equals(initialState);
        boolean terminal = state.optionalBoolean("is_terminal", false);
        return new StateDefinition(name, initial, terminal,
            state.stringList("entry_actions"),
            state.stringList("exit_actions"));
    }

    private static TransitionDefinition parseTransition(Fields transition) {
        String from = transition.requiredString("from_state");
        String to = transition.requiredString("to_state");
        String trigger = transition.requiredString("trigger");
        List<String> actions = transition.stringList("actions");
        if (from == null || to == null || trigger == null) {
            return null;
        }
        return new TransitionDefinition(transition.optionalString("transition_name"), from, to, trigger, actions);
    }

    /**
     * 맵 필드 접근 헬퍼. 위반 사항은 루트와 공유하는 목록에 누적됩니다.
     */
    private static final class Fields {

        private final String path;
        private final Map<String, Object> values;
        private final List<String> violations;

        Fields(String path, Map<String, Object> values) {
            this(path, values, new ArrayList<>());
        }

        private Fields(String path, Map<String, Object> values, List<String> violations) {
            this.path = path;
            this.values = values;
            this.violations = violations;
        }

        void violation(String message) {
            violations.add(message);
        }

        String requiredString(String key) {
            Object value = values.get(key);
            if (value == null || String.valueOf(value).isBlank()) {
                violation(path + "." + key + " is required");
                return null;
            }
            return String.valueOf(value).trim();
        }

        String optionalString(String key) {
            Object value = values.get(key);
            if (value == null || String.valueOf(value).isBlank()) {
                return null;
            }
            return String.valueOf(value).trim();
        }

        boolean optionalBoolean(String key, boolean defaultValue) {
            Object value = values.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof Boolean b) {
                return b;
            }
            String text = String.valueOf(value).trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
            violation(path + "." + key + " must be a boolean (current: " + value + ")");
            return defaultValue;
        }

        long optionalLong(String key, long defaultValue) {
            Object value = values.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (value instanceof Number n) {
                return n.longValue();
            }
            try {
                return Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                violation(path + "." + key + " must be an integer (current: " + value + ")");
                return defaultValue;
            }
        }

        ContractVersion requiredVersion(String key) {
            if (values.get(key) == null) {
                violation(path + "." + key + " is required");
                return null;
            }
            return optionalVersion(key, null);
        }

        ContractVersion optionalVersion(String key, ContractVersion defaultValue) {
            Object value = values.get(key);
            if (value == null) {
                return defaultValue;
            }
            try {
                if (value instanceof Map<?, ?> map) {
                    return ContractVersion.of(
                        component(map, "major"),
                        component(map, "minor"),
                        component(map, "patch"));
                }
                return ContractVersion.parse(String.valueOf(value));
            } catch (IllegalArgumentException e) {
                violation(path + "." + key + " is not a well-formed semantic version: " + e.getMessage());
                return null;
            }
        }

        private int component(Map<?, ?> map, String name) {
            Object value = map.get(name);
            if (value instanceof Number n && n.doubleValue() == n.intValue()) {
                return n.intValue();
            }
            if (value != null && String.valueOf(value).trim().matches("\\d+")) {
                return Integer.parseInt(String.valueOf(value).trim());
            }
            throw new IllegalArgumentException(name + " must be a non-negative integer (current: " + value + ")");
        }

        Map<String, Object> optionalMap(String key) {
            Object value = values.get(key);
            if (value == null) {
                return Map.of();
            }
            if (!(value instanceof Map<?, ?> map)) {
                violation(path + "." + key + " must be a mapping");
                return Map.of();
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            return copy;
        }

        List<String> stringList(String key) {
            Object value = values.get(key);
            if (value == null) {
                return List.of();
            }
            if (!(value instanceof List<?> list)) {
                violation(path + "." + key + " must be a list");
                return List.of();
            }
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item instanceof Map<?, ?> inline && inline.get("action_name") != null) {
                    // 인라인 액션 참조는 이름만 사용
                    result.add(String.valueOf(inline.get("action_name")).trim());
                } else if (item == null || String.valueOf(item).isBlank()) {
                    violation(path + "." + key + " contains an empty entry");
                } else {
                    result.add(String.valueOf(item).trim());
                }
            }
            return result;
        }

        List<Fields> objectList(String key, boolean required) {
            Object value = values.get(key);
            if (value == null) {
                if (required) {
                    violation(path + "." + key + " is required");
                }
                return List.of();
            }
            if (!(value instanceof List<?> list)) {
                violation(path + "." + key + " must be a list");
                return List.of();
            }
            List<Fields> result = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                Object item = list.get(i);
                String itemPath = key + "[" + i + "]";
                if (!(item instanceof Map<?, ?> map)) {
                    violation(itemPath + " must be a mapping");
                    continue;
                }
                Map<String, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(String.valueOf(k), v));
                result.add(new Fields(itemPath, copy, violations));
            }
            return result;
        }
    }
}
