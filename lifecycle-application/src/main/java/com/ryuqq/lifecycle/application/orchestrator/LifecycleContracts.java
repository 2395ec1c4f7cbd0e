package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.model.Contract;

import java.util.ArrayList;
import java.util.List;

/**
 * 내장 인스턴스(로더, 레지스트리, 노드 그래프)의 라이프사이클 계약 묶음.
 *
 * <p>생성 시 각 계약이 역할에 필요한 이벤트와 준비 상태를 모두 가지는지 검증하며,
 * 부족하면 {@link SchemaException}으로 즉시 실패합니다.</p>
 *
 * @param loader contract_loader 계약
 * @param registry contract_registry 계약
 * @param graph node_graph 계약
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleContracts(Contract loader, Contract registry, Contract graph) {

    public LifecycleContracts {
        if (loader == null || registry == null || graph == null) {
            throw new IllegalArgumentException("lifecycle contracts cannot be null");
        }
        check(InstanceRole.CONTRACT_LOADER, loader);
        check(InstanceRole.CONTRACT_REGISTRY, registry);
        check(InstanceRole.NODE_GRAPH, graph);
    }

    /**
     * 역할별 계약 조회.
     *
     * @param role 인스턴스 역할
     * @return 해당 역할의 계약
     */
    public Contract forRole(InstanceRole role) {
        return switch (role) {
            case CONTRACT_LOADER -> loader;
            case CONTRACT_REGISTRY -> registry;
            case NODE_GRAPH -> graph;
        };
    }

    private static void check(InstanceRole role, Contract contract) {
        List<String> violations = new ArrayList<>();
        for (String event : role.requiredEvents()) {
            if (!contract.handles(event)) {
                violations.add(role.instanceName() + " contract does not handle event '" + event + "'");
            }
        }
        if (!contract.hasState(role.readyState())) {
            violations.add(role.instanceName() + " contract does not declare state '" + role.readyState() + "'");
        }
        if (!contract.hasState(role.errorState()) || !contract.isTerminal(role.errorState())) {
            violations.add(role.instanceName() + " contract does not declare terminal state '"
                + role.errorState() + "'");
        }
        if (!violations.isEmpty()) {
            throw new SchemaException(contract.nodeName(), violations);
        }
    }
}
