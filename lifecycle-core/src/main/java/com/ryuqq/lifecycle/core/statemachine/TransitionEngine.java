package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.error.InstanceBusyException;
import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.executor.ActionExecutor;
import com.ryuqq.lifecycle.core.executor.ActionPhase;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;
import com.ryuqq.lifecycle.core.outcome.ActionOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 계약을 해석해 이벤트를 적용하는 전이 엔진.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>인스턴스 잠금 획득 실패 시 {@link InstanceBusyException}</li>
 *   <li>(현재 상태, 이벤트) 정확 매칭, 없으면 와일드카드, 그래도 없으면 NoMatch</li>
 *   <li>exit_actions(출발) → transition.actions → entry_actions(도착) 순서로 순차 실행</li>
 *   <li>치명 액션 실패: 나머지 액션 중단, 성공한 액션의 롤백을 역순 실행, 출발 상태 유지</li>
 *   <li>비치명 액션 실패: 기록 후 계속 진행</li>
 *   <li>모두 끝나면 도착 상태로 커밋하고 generation 1 증가</li>
 * </ol>
 *
 * <p>엔진은 상태를 가지지 않으며, 여러 인스턴스가 하나의 엔진을 공유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final ActionExecutor executor;

    /**
     * 생성자.
     *
     * @param executor 액션 실행자
     * @throws IllegalArgumentException executor가 null인 경우
     */
    public TransitionEngine(ActionExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 이벤트 적용.
     *
     * @param instance 대상 인스턴스
     * @param event 이벤트 이름
     * @param correlationId 상관관계 ID
     * @return Committed, NoMatch 또는 Aborted
     * @throws IllegalArgumentException 인자가 null이거나 빈 문자열인 경우
     * @throws InstanceBusyException 다른 전이가 진행 중인 경우
     */
    public TransitionResult apply(FsmInstance instance, String event, String correlationId) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (!instance.tryBegin()) {
            log.debug("Rejected event {} for instance {}: transition in flight", event, instance.name());
            throw new InstanceBusyException(instance.name(), event);
        }
        try {
            TransitionResult result = run(instance, event, correlationId);
            instance.record(result);
            return result;
        } finally {
            instance.release();
        }
    }

    private TransitionResult run(FsmInstance instance, String event, String correlationId) {
        Contract contract = instance.contract();
        String source = instance.currentState();

        Optional<TransitionDefinition> match = contract.findTransition(source, event);
        if (match.isEmpty()) {
            log.debug("No transition for event {} in state {} of instance {}", event, source, instance.name());
            return new TransitionResult.NoMatch(source, event);
        }

        TransitionDefinition transition = match.get();
        StateDefinition from = contract.state(source);
        StateDefinition to = contract.state(transition.toState());
        ActionContext base = new ActionContext(instance.name(), contract.nodeType(), event,
            source, to.name(), correlationId, instance.generation(), ActionPhase.EXIT);

        List<Step> steps = List.of(
            new Step(ActionPhase.EXIT, from.exitActions()),
            new Step(ActionPhase.TRANSITION, transition.actions()),
            new Step(ActionPhase.ENTRY, to.entryActions())
        );

        List<ActionRecord> actionLog = new ArrayList<>();
        List<ActionDefinition> succeeded = new ArrayList<>();

        for (Step step : steps) {
            ActionContext context = base.withPhase(step.phase());
            for (ActionDefinition action : contract.resolveActions(step.actionNames())) {
                ActionOutcome outcome = execute(action, context);
                actionLog.add(new ActionRecord(step.phase(), action.name(), action.critical(), outcome));

                if (outcome instanceof ActionFailure failure) {
                    if (action.critical()) {
                        log.error("Transition {} on {} aborted: critical {} action '{}' failed [{}] {}",
                            transition.name(), instance.name(), step.phase(), action.name(),
                            failure.errorCode(), failure.message());
                        List<ActionRecord> rollbacks = rollback(contract, succeeded, base);
                        return new TransitionResult.Aborted(transition, source, to.name(), failure,
                            actionLog, rollbacks);
                    }
                    log.warn("Non-critical {} action '{}' failed on {} during {} [{}] {}",
                        step.phase(), action.name(), instance.name(), transition.name(),
                        failure.errorCode(), failure.message());
                } else {
                    succeeded.add(action);
                }
            }
        }

        long generation = instance.commit(to.name());
        log.debug("Committed {} on {}: {} -> {} (generation={})",
            transition.name(), instance.name(), source, to.name(), generation);
        return new TransitionResult.Committed(transition, source, to.name(), generation, actionLog);
    }

    private ActionOutcome execute(ActionDefinition action, ActionContext context) {
        log.debug("Executing {} action '{}' ({}) for {} [{} -> {}]", context.phase(), action.name(),
            action.type().wireName(), context.instanceName(), context.sourceState(), context.targetState());
        try {
            ActionOutcome outcome = executor.execute(action, context);
            if (outcome == null) {
                return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED, "Executor returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Executor threw for action '{}' on {}: {}", action.name(), context.instanceName(),
                e.getMessage(), e);
            return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED,
                "Executor threw " + e.getClass().getSimpleName(), e.getMessage());
        }
    }

    /**
     * 성공한 액션의 롤백을 역순으로 실행 (best effort).
     */
    private List<ActionRecord> rollback(Contract contract, List<ActionDefinition> succeeded, ActionContext base) {
        List<ActionRecord> rollbacks = new ArrayList<>();
        ActionContext context = base.withPhase(ActionPhase.ROLLBACK);
        for (int i = succeeded.size() - 1; i >= 0; i--) {
            ActionDefinition action = succeeded.get(i);
            if (!action.hasRollback()) {
                continue;
            }
            ActionDefinition compensation = contract.action(action.rollbackAction());
            ActionOutcome outcome = execute(compensation, context);
            rollbacks.add(new ActionRecord(ActionPhase.ROLLBACK, compensation.name(), false, outcome));
            if (outcome instanceof ActionFailure failure) {
                log.warn("Rollback action '{}' for '{}' failed on {} [{}] {}", compensation.name(),
                    action.name(), context.instanceName(), failure.errorCode(), failure.message());
            }
        }
        return rollbacks;
    }

    private record Step(ActionPhase phase, List<String> actionNames) {
    }
}
