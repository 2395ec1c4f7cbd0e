package com.ryuqq.lifecycle.adapter.yaml.bundled;

import com.ryuqq.lifecycle.adapter.yaml.source.ClasspathContractSource;
import com.ryuqq.lifecycle.application.orchestrator.LifecycleContracts;
import com.ryuqq.lifecycle.core.contract.ContractParser;
import com.ryuqq.lifecycle.core.contract.ContractDocument;
import com.ryuqq.lifecycle.core.model.Contract;

import java.util.List;

/**
 * 모듈에 포함된 내장 라이프사이클 계약 로더.
 *
 * <p>{@code contracts/} 리소스의 로더, 레지스트리, 노드 그래프 계약을 읽어
 * {@link LifecycleContracts}로 묶습니다. 계약이 역할에 필요한 이벤트를 처리하지 않으면
 * {@link com.ryuqq.lifecycle.core.error.SchemaException}으로 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BundledLifecycleContracts {

    public static final String LOADER_RESOURCE = "contracts/contract_loader.yaml";
    public static final String REGISTRY_RESOURCE = "contracts/contract_registry.yaml";
    public static final String GRAPH_RESOURCE = "contracts/node_graph.yaml";

    private BundledLifecycleContracts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 내장 계약 적재.
     *
     * @return 검증된 라이프사이클 계약 묶음
     * @throws com.ryuqq.lifecycle.core.error.ContractSourceException 리소스를 읽지 못한 경우
     * @throws com.ryuqq.lifecycle.core.error.SchemaException 계약 검증 실패 시
     */
    public static LifecycleContracts load() {
        List<ContractDocument> documents = new ClasspathContractSource(
            List.of(LOADER_RESOURCE, REGISTRY_RESOURCE, GRAPH_RESOURCE)).discover();

        Contract loader = ContractParser.parse(documents.get(0));
        Contract registry = ContractParser.parse(documents.get(1));
        Contract graph = ContractParser.parse(documents.get(2));
        return new LifecycleContracts(loader, registry, graph);
    }
}
