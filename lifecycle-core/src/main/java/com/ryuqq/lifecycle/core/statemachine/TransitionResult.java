package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.model.TransitionDefinition;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;

import java.util.List;

/**
 * 이벤트 한 건을 적용한 결과.
 *
 * <ul>
 *   <li>{@link Committed}: 모든 치명 액션 성공, 도착 상태로 전이 완료</li>
 *   <li>{@link NoMatch}: 적용할 전이 없음 (상태 불변, 오류 아님)</li>
 *   <li>{@link Aborted}: 치명 액션 실패, 롤백 후 출발 상태 유지</li>
 * </ul>
 *
 * <p>Busy는 결과가 아니라 {@link com.ryuqq.lifecycle.core.error.InstanceBusyException}으로 보고됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface TransitionResult {

    /**
     * 이 결과 이후 인스턴스의 현재 상태.
     *
     * @return 상태 이름
     */
    String resultingState();

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    default boolean isNoMatch() {
        return this instanceof NoMatch;
    }

    default boolean isAborted() {
        return this instanceof Aborted;
    }

    /**
     * 커밋된 전이.
     *
     * @param transition 적용된 전이
     * @param fromState 출발 상태
     * @param toState 도착 상태
     * @param generation 커밋 후 generation
     * @param actionLog 실행 순서대로의 액션 기록 (비치명 실패 포함)
     */
    record Committed(
        TransitionDefinition transition,
        String fromState,
        String toState,
        long generation,
        List<ActionRecord> actionLog
    ) implements TransitionResult {

        public Committed {
            actionLog = List.copyOf(actionLog);
        }

        @Override
        public String resultingState() {
            return toState;
        }

        /**
         * 기록된 비치명 실패 목록.
         *
         * @return 실패한 액션 기록
         */
        public List<ActionRecord> failures() {
            return actionLog.stream().filter(ActionRecord::failed).toList();
        }
    }

    /**
     * 적용할 전이 없음.
     *
     * @param state 현재 상태
     * @param event 전달된 이벤트
     */
    record NoMatch(String state, String event) implements TransitionResult {

        @Override
        public String resultingState() {
            return state;
        }
    }

    /**
     * 치명 액션 실패로 중단된 전이.
     *
     * @param transition 시도한 전이
     * @param fromState 출발 상태 (현재 상태로 유지됨)
     * @param attemptedState 도착하려던 상태
     * @param failure 중단을 일으킨 실패
     * @param actionLog 중단 시점까지 실행된 액션 기록 (실패한 액션 포함)
     * @param rollbacks 실행된 롤백 액션 기록 (역순)
     */
    record Aborted(
        TransitionDefinition transition,
        String fromState,
        String attemptedState,
        ActionFailure failure,
        List<ActionRecord> actionLog,
        List<ActionRecord> rollbacks
    ) implements TransitionResult {

        public Aborted {
            if (failure == null) {
                throw new IllegalArgumentException("failure cannot be null");
            }
            actionLog = List.copyOf(actionLog);
            rollbacks = List.copyOf(rollbacks);
        }

        @Override
        public String resultingState() {
            return fromState;
        }
    }
}
