package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.error.InstanceBusyException;
import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.executor.ActionExecutor;
import com.ryuqq.lifecycle.core.executor.ActionPhase;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.model.ContractVersion;
import com.ryuqq.lifecycle.core.model.NodeType;
import com.ryuqq.lifecycle.core.model.StateDefinition;
import com.ryuqq.lifecycle.core.model.TransitionDefinition;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;
import com.ryuqq.lifecycle.core.outcome.ActionSuccess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TransitionEngine 유닛 테스트.
 *
 * <p>ActionExecutor를 Mock으로 대체하고 엔진의 순서, 중단, 롤백 규칙을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TransitionEngineTest {

    @Mock
    private ActionExecutor executor;

    private TransitionEngine engine;
    private Contract contract;
    private final List<String> executed = new ArrayList<>();
    private final List<ActionContext> contexts = new ArrayList<>();

    @BeforeEach
    void setUp() {
        engine = new TransitionEngine(executor);
        contract = Contract.builder(NodeType.ORCHESTRATOR_GENERIC, ContractVersion.of(1, 0, 0))
            .nodeName("graph")
            .action(ActionDefinition.of("release_init", ActionType.CLEANUP).withCritical(true))
            .action(ActionDefinition.of("resolve", ActionType.PERSISTENCE).withRollbackAction("unresolve"))
            .action(ActionDefinition.of("unresolve", ActionType.CLEANUP))
            .action(ActionDefinition.of("announce", ActionType.EVENT))
            .action(ActionDefinition.of("persist", ActionType.PERSISTENCE).withCritical(true).withRollbackAction("unpersist"))
            .action(ActionDefinition.of("unpersist", ActionType.CLEANUP))
            .action(ActionDefinition.of("open", ActionType.LOGGING).withCritical(true))
            .state(StateDefinition.of("initializing").asInitial().withExitActions("release_init"))
            .state(StateDefinition.of("wiring").withEntryActions("persist", "open"))
            .state(StateDefinition.of("running"))
            .state(StateDefinition.of("stopped").asTerminal())
            .transition(TransitionDefinition.of("initializing", "start", "wiring").withActions("resolve", "announce"))
            .transition(TransitionDefinition.of("wiring", "wiring_complete", "running"))
            .transition(TransitionDefinition.of("running", "shutdown_requested", "running"))
            .transition(TransitionDefinition.of("*", "shutdown_requested", "stopped"))
            .build();
    }

    private void stubExecutor(String... failing) {
        Set<String> failures = Set.of(failing);
        when(executor.execute(any(), any())).thenAnswer(invocation -> {
            ActionDefinition action = invocation.getArgument(0);
            ActionContext context = invocation.getArgument(1);
            executed.add(action.name());
            contexts.add(context);
            if (failures.contains(action.name())) {
                return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED, action.name() + " failed");
            }
            return ActionSuccess.of(action.name(), 1);
        });
    }

    private FsmInstance newInstance() {
        return new FsmInstance("graph", contract, engine);
    }

    // ============================================================
    // 1. 커밋: 실행 순서와 generation
    // ============================================================

    @Test
    void apply_모든_액션_성공시_exit_transition_entry_순서로_실행하고_커밋() {
        // given
        stubExecutor();
        FsmInstance instance = newInstance();

        // when
        TransitionResult result = engine.apply(instance, "start", "corr-1");

        // then
        assertThat(result).isInstanceOf(TransitionResult.Committed.class);
        assertThat(executed).containsExactly("release_init", "resolve", "announce", "persist", "open");
        assertThat(contexts).extracting(ActionContext::phase).containsExactly(
            ActionPhase.EXIT, ActionPhase.TRANSITION, ActionPhase.TRANSITION, ActionPhase.ENTRY, ActionPhase.ENTRY);
        assertThat(contexts).allMatch(c -> c.correlationId().equals("corr-1")
            && c.sourceState().equals("initializing") && c.targetState().equals("wiring") && c.generation() == 0);
        assertThat(instance.currentState()).isEqualTo("wiring");
        assertThat(instance.generation()).isEqualTo(1);
        assertThat(instance.isInTransition()).isFalse();
        assertThat(instance.lastResult()).isSameAs(result);
    }

    @Test
    void apply_비치명_실패는_기록되고_전이는_커밋됨() {
        // given
        stubExecutor("announce");
        FsmInstance instance = newInstance();

        // when
        TransitionResult.Committed committed = (TransitionResult.Committed) engine.apply(instance, "start", "corr-2");

        // then
        assertThat(committed.toState()).isEqualTo("wiring");
        assertThat(committed.generation()).isEqualTo(1);
        assertThat(committed.failures()).extracting(ActionRecord::actionName).containsExactly("announce");
        assertThat(executed).containsExactly("release_init", "resolve", "announce", "persist", "open");
    }

    // ============================================================
    // 2. 중단: 원자성과 롤백
    // ============================================================

    @Test
    void apply_치명_exit_액션_실패시_중단되고_상태와_generation_유지() {
        // given
        stubExecutor("release_init");
        FsmInstance instance = newInstance();

        // when
        TransitionResult result = engine.apply(instance, "start", "corr-3");

        // then
        assertThat(result).isInstanceOf(TransitionResult.Aborted.class);
        TransitionResult.Aborted aborted = (TransitionResult.Aborted) result;
        assertThat(aborted.failure().actionName()).isEqualTo("release_init");
        assertThat(aborted.fromState()).isEqualTo("initializing");
        assertThat(aborted.attemptedState()).isEqualTo("wiring");
        assertThat(aborted.rollbacks()).isEmpty();
        assertThat(executed).containsExactly("release_init");
        assertThat(instance.currentState()).isEqualTo("initializing");
        assertThat(instance.generation()).isZero();
        assertThat(instance.isInTransition()).isFalse();
    }

    @Test
    void apply_치명_entry_실패시_성공한_액션만_역순으로_롤백() {
        // given: persist는 성공, open이 치명 실패
        stubExecutor("open");
        FsmInstance instance = newInstance();

        // when
        TransitionResult.Aborted aborted = (TransitionResult.Aborted) engine.apply(instance, "start", "corr-4");

        // then
        assertThat(aborted.rollbacks()).extracting(ActionRecord::actionName).containsExactly("unpersist", "unresolve");
        assertThat(aborted.rollbacks()).allMatch(r -> r.phase() == ActionPhase.ROLLBACK);
        assertThat(executed).containsExactly(
            "release_init", "resolve", "announce", "persist", "open", "unpersist", "unresolve");
        assertThat(instance.currentState()).isEqualTo("initializing");
    }

    @Test
    void apply_롤백_실패는_기록만_되고_나머지_롤백은_계속됨() {
        // given
        stubExecutor("open", "unpersist");
        FsmInstance instance = newInstance();

        // when
        TransitionResult.Aborted aborted = (TransitionResult.Aborted) engine.apply(instance, "start", "corr-5");

        // then
        assertThat(aborted.rollbacks()).extracting(ActionRecord::actionName).containsExactly("unpersist", "unresolve");
        assertThat(aborted.rollbacks().get(0).failed()).isTrue();
        assertThat(aborted.rollbacks().get(1).failed()).isFalse();
        assertThat(aborted.failure().actionName()).isEqualTo("open");
    }

    @Test
    void apply_실패한_액션_자체의_롤백은_실행하지_않음() {
        // given: persist가 치명 실패 (persist의 rollback은 unpersist)
        stubExecutor("persist");
        FsmInstance instance = newInstance();

        // when
        TransitionResult.Aborted aborted = (TransitionResult.Aborted) engine.apply(instance, "start", "corr-6");

        // then
        assertThat(aborted.rollbacks()).extracting(ActionRecord::actionName).containsExactly("unresolve");
    }

    @Test
    void apply_executor가_예외를_던지면_ACTION_FAILED로_분류() {
        // given
        when(executor.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
        FsmInstance instance = newInstance();

        // when
        TransitionResult.Aborted aborted = (TransitionResult.Aborted) engine.apply(instance, "start", "corr-7");

        // then
        assertThat(aborted.failure().errorCode()).isEqualTo(ActionFailure.ACTION_FAILED);
        assertThat(aborted.failure().cause()).isEqualTo("boom");
        assertThat(instance.currentState()).isEqualTo("initializing");
    }

    // ============================================================
    // 3. NoMatch, Busy, 와일드카드
    // ============================================================

    @Test
    void apply_매칭되는_전이가_없으면_NoMatch_상태_불변() {
        // given
        FsmInstance instance = newInstance();

        // when
        TransitionResult result = engine.apply(instance, "wiring_complete", "corr-8");

        // then
        assertThat(result).isEqualTo(new TransitionResult.NoMatch("initializing", "wiring_complete"));
        assertThat(instance.generation()).isZero();
        assertThat(instance.isInTransition()).isFalse();
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void apply_전이_진행_중이면_Busy() {
        // given
        FsmInstance instance = newInstance();
        assertThat(instance.tryBegin()).isTrue();

        // when & then
        assertThatThrownBy(() -> engine.apply(instance, "start", "corr-9"))
            .isInstanceOf(InstanceBusyException.class)
            .hasMessageContaining("graph");
        assertThat(instance.isInTransition()).isTrue();
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void apply_정확_매칭이_와일드카드보다_우선() {
        // given
        stubExecutor();
        FsmInstance instance = newInstance();
        engine.apply(instance, "start", "c1");
        engine.apply(instance, "wiring_complete", "c2");

        // when: running에는 shutdown_requested 정확 전이(running→running)가 있음
        TransitionResult.Committed committed =
            (TransitionResult.Committed) engine.apply(instance, "shutdown_requested", "c3");

        // then
        assertThat(committed.transition().isWildcard()).isFalse();
        assertThat(instance.currentState()).isEqualTo("running");
        assertThat(instance.generation()).isEqualTo(3);
    }

    @Test
    void apply_와일드카드는_종료_상태에서_NoMatch() {
        // given
        stubExecutor();
        FsmInstance instance = newInstance();
        TransitionResult first = engine.apply(instance, "shutdown_requested", "c1");

        // when
        TransitionResult second = engine.apply(instance, "shutdown_requested", "c2");

        // then
        assertThat(first.isCommitted()).isTrue();
        assertThat(second.isNoMatch()).isTrue();
        assertThat(instance.currentState()).isEqualTo("stopped");
        assertThat(instance.generation()).isEqualTo(1);
    }

    @Test
    void apply_잘못된_인자는_IllegalArgumentException() {
        FsmInstance instance = newInstance();

        assertThatThrownBy(() -> engine.apply(null, "start", "c")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.apply(instance, " ", "c")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.apply(instance, "start", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
