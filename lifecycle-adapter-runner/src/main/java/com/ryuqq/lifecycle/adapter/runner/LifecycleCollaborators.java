package com.ryuqq.lifecycle.adapter.runner;

import com.ryuqq.lifecycle.core.spi.AlertNotifier;
import com.ryuqq.lifecycle.core.spi.ContractSource;
import com.ryuqq.lifecycle.core.spi.DiagnosticStore;
import com.ryuqq.lifecycle.core.spi.EventBus;
import com.ryuqq.lifecycle.core.spi.ResourceReleaser;
import com.ryuqq.lifecycle.core.spi.SnapshotStore;

/**
 * 오케스트레이터가 소유하고 명시적으로 전달하는 외부 협력자 묶음.
 *
 * @param contractSource 노드 계약 저장소
 * @param eventBus 이벤트 버스
 * @param snapshotStore 상태 스냅샷 저장소
 * @param diagnosticStore 진단 저장소 (write-once)
 * @param alertNotifier 알림 엔드포인트
 * @param resourceReleaser 자원 해제기
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record LifecycleCollaborators(
    ContractSource contractSource,
    EventBus eventBus,
    SnapshotStore snapshotStore,
    DiagnosticStore diagnosticStore,
    AlertNotifier alertNotifier,
    ResourceReleaser resourceReleaser
) {

    public LifecycleCollaborators {
        if (contractSource == null) {
            throw new IllegalArgumentException("contractSource cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        if (diagnosticStore == null) {
            throw new IllegalArgumentException("diagnosticStore cannot be null");
        }
        if (alertNotifier == null) {
            throw new IllegalArgumentException("alertNotifier cannot be null");
        }
        if (resourceReleaser == null) {
            throw new IllegalArgumentException("resourceReleaser cannot be null");
        }
    }
}
