package com.ryuqq.lifecycle.core.model;

/**
 * 노드 간 wiring 요청.
 *
 * @param nodeName 의존 대상 노드 이름
 * @param minimumVersion 요구하는 최소 계약 버전 (major는 동일해야 함)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NodeDependency(String nodeName, ContractVersion minimumVersion) {

    public NodeDependency {
        if (nodeName == null || nodeName.isBlank()) {
            throw new IllegalArgumentException("dependency node_name cannot be null or blank");
        }
        if (minimumVersion == null) {
            throw new IllegalArgumentException("dependency version cannot be null (node: " + nodeName + ")");
        }
    }
}
