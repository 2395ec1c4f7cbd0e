package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.executor.ActionExecutor;
import com.ryuqq.lifecycle.core.executor.ActionPhase;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.outcome.ActionFailure;
import com.ryuqq.lifecycle.core.outcome.ActionOutcome;
import com.ryuqq.lifecycle.core.outcome.ActionSuccess;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Programmable {@link ActionExecutor} for contract tests.
 *
 * <p>Every invocation is recorded in call order. Individual actions can be scripted to fail,
 * to throw, or to block on a latch so that tests can hold a transition in flight.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingActionExecutor executor = new RecordingActionExecutor();
 * executor.failOn("persist_state", "disk full");
 * executor.blockOn("capture_state", entered, release);
 *
 * FsmInstance instance = new FsmInstance("billing", contract, new TransitionEngine(executor));
 * instance.handle("start");
 *
 * assertEquals(List.of("prepare", "announce", "warm_up"), executor.executedNames());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingActionExecutor implements ActionExecutor {

    private final List<Execution> executions = new CopyOnWriteArrayList<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> throwing = new ConcurrentHashMap<>();
    private final Map<String, Gate> gates = new ConcurrentHashMap<>();

    @Override
    public ActionOutcome execute(ActionDefinition action, ActionContext context) {
        executions.add(new Execution(action.name(), context.phase(), context.instanceName(),
            context.sourceState(), context.targetState(), context.generation(), Thread.currentThread().getName()));

        Gate gate = gates.get(action.name());
        if (gate != null) {
            gate.pass();
        }

        RuntimeException toThrow = throwing.get(action.name());
        if (toThrow != null) {
            throw toThrow;
        }
        String failure = failures.get(action.name());
        if (failure != null) {
            return ActionFailure.of(action.name(), ActionFailure.ACTION_FAILED, failure);
        }
        return ActionSuccess.of(action.name(), 0);
    }

    /**
     * Makes the named action return an {@code ACTION_FAILED} outcome.
     *
     * @param actionName action to fail
     * @param message failure message
     * @return this executor
     */
    public RecordingActionExecutor failOn(String actionName, String message) {
        failures.put(actionName, message);
        return this;
    }

    public RecordingActionExecutor failOn(String actionName) {
        return failOn(actionName, actionName + " failed");
    }

    /**
     * Makes the named action throw instead of returning an outcome.
     *
     * @param actionName action to throw from
     * @param exception exception to throw
     * @return this executor
     */
    public RecordingActionExecutor throwOn(String actionName, RuntimeException exception) {
        throwing.put(actionName, exception);
        return this;
    }

    /**
     * Blocks the named action until {@code release} opens.
     *
     * <p>{@code entered} is counted down when the action starts, so the test knows a transition
     * is in flight.</p>
     *
     * @param actionName action to block
     * @param entered counted down on entry
     * @param release awaited before the action completes
     * @return this executor
     */
    public RecordingActionExecutor blockOn(String actionName, CountDownLatch entered, CountDownLatch release) {
        gates.put(actionName, new Gate(entered, release));
        return this;
    }

    public void reset() {
        executions.clear();
        failures.clear();
        throwing.clear();
        gates.clear();
    }

    public List<Execution> executions() {
        return new ArrayList<>(executions);
    }

    public List<String> executedNames() {
        return executions.stream().map(Execution::actionName).collect(Collectors.toList());
    }

    public List<String> executedNames(ActionPhase phase) {
        return executions.stream()
            .filter(execution -> execution.phase() == phase)
            .map(Execution::actionName)
            .collect(Collectors.toList());
    }

    public long count(String actionName) {
        return executions.stream().filter(execution -> execution.actionName().equals(actionName)).count();
    }

    /**
     * One recorded action invocation.
     *
     * @param actionName action name
     * @param phase execution phase
     * @param instanceName owning instance
     * @param sourceState state the transition left
     * @param targetState state the transition entered
     * @param generation generation at transition start
     * @param threadName calling thread
     */
    public record Execution(
        String actionName,
        ActionPhase phase,
        String instanceName,
        String sourceState,
        String targetState,
        long generation,
        String threadName
    ) {
    }

    private record Gate(CountDownLatch entered, CountDownLatch release) {

        void pass() {
            entered.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Gate was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while blocked on gate", e);
            }
        }
    }
}
