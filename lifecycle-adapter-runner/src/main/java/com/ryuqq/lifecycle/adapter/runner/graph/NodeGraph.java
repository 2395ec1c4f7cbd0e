package com.ryuqq.lifecycle.adapter.runner.graph;

import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.NodeDependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 노드 계약 간 의존성 그래프.
 *
 * <p>{@link #resolve(List)}는 노드를 위상 정렬하여 의존 대상이 항상 먼저 오도록 합니다.
 * 같은 단계의 노드는 입력 순서를 유지합니다.</p>
 *
 * <p><strong>검증 (모두 모아서 SchemaException으로 보고):</strong></p>
 * <ul>
 *   <li>중복 노드 이름</li>
 *   <li>선언되지 않은 노드에 대한 의존</li>
 *   <li>요구 버전을 만족하지 않는 의존 (major 동일, 더 오래되지 않음)</li>
 *   <li>순환 의존</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NodeGraph {

    public static final String GRAPH_SOURCE = "node_graph";

    private final List<Contract> order;

    private NodeGraph(List<Contract> order) {
        this.order = List.copyOf(order);
    }

    /**
     * 의존성 해석.
     *
     * @param contracts 검증된 노드 계약
     * @return 위상 정렬된 그래프
     * @throws SchemaException 의존성 검증 실패 시
     */
    public static NodeGraph resolve(List<Contract> contracts) {
        if (contracts == null) {
            throw new IllegalArgumentException("contracts cannot be null");
        }

        List<String> violations = new ArrayList<>();
        Map<String, Contract> byName = new LinkedHashMap<>();
        for (Contract contract : contracts) {
            if (byName.putIfAbsent(contract.nodeName(), contract) != null) {
                violations.add("duplicate node '" + contract.nodeName() + "'");
            }
        }

        for (Contract contract : byName.values()) {
            for (NodeDependency dependency : contract.dependencies()) {
                Contract target = byName.get(dependency.nodeName());
                if (target == null) {
                    violations.add(String.format("node '%s' depends on undeclared node '%s'",
                        contract.nodeName(), dependency.nodeName()));
                } else if (!target.version().satisfies(dependency.minimumVersion())) {
                    violations.add(String.format("node '%s' requires %s %s but %s is declared",
                        contract.nodeName(), dependency.nodeName(), dependency.minimumVersion(), target.version()));
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new SchemaException(GRAPH_SOURCE, violations);
        }

        return new NodeGraph(sort(byName));
    }

    private static List<Contract> sort(Map<String, Contract> byName) {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Contract contract : byName.values()) {
            pending.put(contract.nodeName(), contract.dependencies().size());
            for (NodeDependency dependency : contract.dependencies()) {
                dependents.computeIfAbsent(dependency.nodeName(), k -> new ArrayList<>()).add(contract.nodeName());
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        for (Contract contract : byName.values()) {
            if (pending.get(contract.nodeName()) == 0) {
                ready.add(contract.nodeName());
            }
        }

        List<Contract> order = new ArrayList<>(byName.size());
        while (!ready.isEmpty()) {
            String name = ready.poll();
            order.add(byName.get(name));
            for (String dependent : dependents.getOrDefault(name, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < byName.size()) {
            String cyclic = byName.keySet().stream()
                .filter(name -> pending.get(name) > 0)
                .collect(Collectors.joining(", "));
            throw new SchemaException(GRAPH_SOURCE, "dependency cycle between nodes: " + cyclic);
        }
        return order;
    }

    /**
     * 위상 정렬된 노드 계약.
     *
     * @return 의존 대상이 먼저 오는 순서
     */
    public List<Contract> order() {
        return order;
    }

    public List<String> nodeNames() {
        return order.stream().map(Contract::nodeName).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }
}
