package com.ryuqq.lifecycle.application.orchestrator;

import java.util.List;

import static com.ryuqq.lifecycle.application.orchestrator.LifecycleEvents.*;

/**
 * 오케스트레이터가 직접 구동하는 내장 인스턴스의 역할.
 *
 * <p>각 역할은 계약이 반드시 처리해야 하는 이벤트와, 시작 완료로 간주하는 상태,
 * 실패로 간주하는 상태를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum InstanceRole {

    CONTRACT_LOADER("contract_loader", "ready", "error",
        List.of(DISCOVER, CONTRACTS_DISCOVERED, DISCOVERY_FAILED, SHUTDOWN_REQUESTED, FATAL_ERROR)),

    CONTRACT_REGISTRY("contract_registry", "ready", "error",
        List.of(VALIDATE, VALIDATION_PASSED, VALIDATION_FAILED, SHUTDOWN_REQUESTED, FATAL_ERROR)),

    NODE_GRAPH("node_graph", "running", "error",
        List.of(DEPENDENCIES_RESOLVED, WIRING_COMPLETE, SHUTDOWN_REQUESTED, DRAIN_COMPLETE, FATAL_ERROR));

    private final String instanceName;
    private final String readyState;
    private final String errorState;
    private final List<String> requiredEvents;

    InstanceRole(String instanceName, String readyState, String errorState, List<String> requiredEvents) {
        this.instanceName = instanceName;
        this.readyState = readyState;
        this.errorState = errorState;
        this.requiredEvents = requiredEvents;
    }

    public String instanceName() {
        return instanceName;
    }

    /**
     * 시작 시퀀스 완료 시 기대하는 상태.
     *
     * @return 준비 상태 이름
     */
    public String readyState() {
        return readyState;
    }

    /**
     * 진입하면 런타임 전체를 실패로 보는 상태.
     *
     * @return 실패 상태 이름
     */
    public String errorState() {
        return errorState;
    }

    public List<String> requiredEvents() {
        return requiredEvents;
    }
}
