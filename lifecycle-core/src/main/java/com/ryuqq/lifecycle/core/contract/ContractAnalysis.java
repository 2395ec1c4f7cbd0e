package com.ryuqq.lifecycle.core.contract;

import java.util.ArrayList;
import java.util.List;

/**
 * 계약 구조 분석 결과 (경고 전용, 로드를 실패시키지 않음).
 *
 * @param nodeName 분석한 계약의 노드 이름
 * @param unreachableStates 초기 상태에서 도달할 수 없는 상태
 * @param deadEndStates 나가는 전이가 없는 비종료 상태
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContractAnalysis(
    String nodeName,
    List<String> unreachableStates,
    List<String> deadEndStates
) {

    public ContractAnalysis {
        unreachableStates = unreachableStates == null ? List.of() : List.copyOf(unreachableStates);
        deadEndStates = deadEndStates == null ? List.of() : List.copyOf(deadEndStates);
    }

    public boolean hasWarnings() {
        return !unreachableStates.isEmpty() || !deadEndStates.isEmpty();
    }

    /**
     * 사람이 읽을 수 있는 경고 목록.
     *
     * @return 경고 메시지 목록 (없으면 빈 목록)
     */
    public List<String> warnings() {
        List<String> warnings = new ArrayList<>();
        for (String state : unreachableStates) {
            warnings.add(nodeName + ": state '" + state + "' is unreachable from the initial state");
        }
        for (String state : deadEndStates) {
            warnings.add(nodeName + ": non-terminal state '" + state + "' has no outbound transition");
        }
        return warnings;
    }
}
