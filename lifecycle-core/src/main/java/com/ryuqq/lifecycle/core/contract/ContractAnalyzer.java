package com.ryuqq.lifecycle.core.contract;

import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 검증을 통과한 계약의 구조 분석.
 *
 * <p>와일드카드 전이는 모든 비종료 상태에서 대상 상태로 가는 간선으로 취급합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContractAnalyzer {

    private ContractAnalyzer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 도달 불가 상태와 막다른 상태 분석.
     *
     * @param contract 분석할 계약
     * @return 분석 결과
     * @throws IllegalArgumentException contract가 null인 경우
     */
    public static ContractAnalysis analyze(Contract contract) {
        if (contract == null) {
            throw new IllegalArgumentException("contract cannot be null");
        }
        Set<String> reachable = reachableStates(contract);

        List<String> unreachable = new ArrayList<>();
        List<String> deadEnds = new ArrayList<>();
        for (StateDefinition state : contract.states().values()) {
            if (!reachable.contains(state.name())) {
                unreachable.add(state.name());
            }
            if (!state.terminal() && successors(contract, state).isEmpty()) {
                deadEnds.add(state.name());
            }
        }
        return new ContractAnalysis(contract.nodeName(), unreachable, deadEnds);
    }

    private static Set<String> reachableStates(Contract contract) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(contract.initialState());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : successors(contract, contract.state(current))) {
                if (!visited.contains(next)) {
                    queue.add(next);
                }
            }
        }
        return visited;
    }

    private static Set<String> successors(Contract contract, StateDefinition state) {
        Set<String> next = new LinkedHashSet<>();
        for (TransitionDefinition transition : contract.transitions()) {
            if (transition.fromState().equals(state.name())) {
                next.add(transition.toState());
            } else if (transition.isWildcard() && !state.terminal()) {
                next.add(transition.toState());
            }
        }
        return next;
    }
}
