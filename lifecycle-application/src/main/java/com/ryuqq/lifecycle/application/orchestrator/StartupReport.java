package com.ryuqq.lifecycle.application.orchestrator;

import java.util.List;

/**
 * 시작 시퀀스 결과.
 *
 * @param nodeNames 검증을 통과한 노드 계약 이름 (발견 순서)
 * @param wiringOrder 의존성 순서대로 정렬된 노드 이름
 * @param warnings 계약 분석 경고
 * @param nonCriticalFailures 시작 중 기록된 비치명 액션 실패
 * @param elapsedMs 시작 소요 시간 (밀리초)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StartupReport(
    List<String> nodeNames,
    List<String> wiringOrder,
    List<String> warnings,
    List<String> nonCriticalFailures,
    long elapsedMs
) {

    public StartupReport {
        nodeNames = List.copyOf(nodeNames);
        wiringOrder = List.copyOf(wiringOrder);
        warnings = List.copyOf(warnings);
        nonCriticalFailures = List.copyOf(nonCriticalFailures);
    }
}
