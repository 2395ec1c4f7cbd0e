package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.lifecycle.adapter.inmemory.effect.InMemoryAlertNotifier;
import com.ryuqq.lifecycle.adapter.inmemory.effect.InMemoryResourceReleaser;
import com.ryuqq.lifecycle.adapter.inmemory.source.InMemoryContractSource;
import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryDiagnosticStore;
import com.ryuqq.lifecycle.adapter.inmemory.store.InMemorySnapshotStore;
import com.ryuqq.lifecycle.adapter.runner.DefaultLifecycleOrchestrator;
import com.ryuqq.lifecycle.adapter.runner.LifecycleCollaborators;
import com.ryuqq.lifecycle.adapter.runner.OrchestratorConfig;
import com.ryuqq.lifecycle.adapter.runner.TimedActionExecutor;
import com.ryuqq.lifecycle.adapter.runner.handler.ActionHandlers;
import com.ryuqq.lifecycle.adapter.yaml.bundled.BundledLifecycleContracts;
import com.ryuqq.lifecycle.core.model.Contract;
import com.ryuqq.lifecycle.core.statemachine.FsmInstance;
import com.ryuqq.lifecycle.core.statemachine.InstanceSnapshot;
import com.ryuqq.lifecycle.core.statemachine.TransitionEngine;
import com.ryuqq.lifecycle.core.statemachine.TransitionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for lifecycle contract tests.
 *
 * <p>Provides a {@link RecordingActionExecutor}-backed {@link TransitionEngine} for instance-level
 * tests, and in-memory collaborators for orchestrator-level tests.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>RecordingActionExecutor: scripted action outcomes, call order, latches</li>
 *   <li>InMemoryContractSource: node contracts discovered at startup</li>
 *   <li>InMemoryEventBus, InMemorySnapshotStore, InMemoryDiagnosticStore,
 *       InMemoryAlertNotifier, InMemoryResourceReleaser: observable side effects</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractLifecycleContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         FsmInstance instance = newInstance("billing", ContractFixtures.wiringContract());
 *         executor.failOn("prepare_wiring");
 *
 *         assertAborted(apply(instance, "start"));
 *         assertState(instance, "initializing", 0);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractLifecycleContractTest {

    protected RecordingActionExecutor executor;
    protected TransitionEngine engine;

    protected InMemoryContractSource contractSource;
    protected InMemoryEventBus eventBus;
    protected InMemorySnapshotStore snapshotStore;
    protected InMemoryDiagnosticStore diagnosticStore;
    protected InMemoryAlertNotifier alertNotifier;
    protected InMemoryResourceReleaser resourceReleaser;

    private final List<TimedActionExecutor> timedExecutors = new ArrayList<>();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of the executor and all collaborators.</p>
     */
    @BeforeEach
    void setUpLifecycleFixtures() {
        executor = new RecordingActionExecutor();
        engine = new TransitionEngine(executor);

        contractSource = new InMemoryContractSource();
        eventBus = new InMemoryEventBus();
        snapshotStore = new InMemorySnapshotStore();
        diagnosticStore = new InMemoryDiagnosticStore();
        alertNotifier = new InMemoryAlertNotifier();
        resourceReleaser = new InMemoryResourceReleaser();
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Closes action threads started by {@link #newOrchestrator()}.</p>
     */
    @AfterEach
    void tearDownLifecycleFixtures() {
        timedExecutors.forEach(TimedActionExecutor::close);
        timedExecutors.clear();
        executor.reset();
    }

    /**
     * Creates an instance driven by the recording executor.
     *
     * @param name instance name
     * @param contract contract to interpret
     * @return new instance in the contract's initial state
     */
    protected FsmInstance newInstance(String name, Contract contract) {
        return new FsmInstance(name, contract, engine);
    }

    /**
     * Applies an event through the engine, returning Aborted results instead of throwing.
     *
     * @param instance target instance
     * @param event event name
     * @return transition result
     */
    protected TransitionResult apply(FsmInstance instance, String event) {
        return engine.apply(instance, event, "test-" + event);
    }

    /**
     * Creates an orchestrator wired to the bundled lifecycle contracts, the in-memory collaborators
     * and the default action handlers.
     *
     * @return orchestrator in the CREATED phase
     */
    protected DefaultLifecycleOrchestrator newOrchestrator() {
        return newOrchestrator(new OrchestratorConfig().withDrainTimeoutMs(100));
    }

    protected DefaultLifecycleOrchestrator newOrchestrator(OrchestratorConfig config) {
        LifecycleCollaborators collaborators = new LifecycleCollaborators(contractSource, eventBus,
            snapshotStore, diagnosticStore, alertNotifier, resourceReleaser);
        TimedActionExecutor timed = new TimedActionExecutor(ActionHandlers.defaults(collaborators));
        timedExecutors.add(timed);
        return new DefaultLifecycleOrchestrator(BundledLifecycleContracts.load(), collaborators, timed, config);
    }

    /**
     * Asserts that the instance is in the expected state and generation.
     *
     * @param instance the instance
     * @param expectedState expected current state
     * @param expectedGeneration expected generation
     */
    protected void assertState(FsmInstance instance, String expectedState, long expectedGeneration) {
        InstanceSnapshot snapshot = instance.snapshot();
        assertEquals(expectedState, snapshot.currentState(),
                String.format("Expected %s to be in state %s but was %s",
                        instance.name(), expectedState, snapshot.currentState()));
        assertEquals(expectedGeneration, snapshot.generation(),
                String.format("Expected %s generation %d but was %d",
                        instance.name(), expectedGeneration, snapshot.generation()));
    }

    /**
     * Asserts that the result is Committed and returns it.
     *
     * @param result transition result
     * @return the committed result
     */
    protected TransitionResult.Committed assertCommitted(TransitionResult result) {
        assertTrue(result instanceof TransitionResult.Committed,
                "Expected a committed transition but was " + result);
        return (TransitionResult.Committed) result;
    }

    /**
     * Asserts that the result is Aborted and returns it.
     *
     * @param result transition result
     * @return the aborted result
     */
    protected TransitionResult.Aborted assertAborted(TransitionResult result) {
        assertTrue(result instanceof TransitionResult.Aborted,
                "Expected an aborted transition but was " + result);
        return (TransitionResult.Aborted) result;
    }

    protected void assertNoMatch(TransitionResult result) {
        assertTrue(result instanceof TransitionResult.NoMatch,
                "Expected no matching transition but was " + result);
    }

    /**
     * Waits for a latch, failing the test if it does not open in time.
     *
     * @param latch the latch
     */
    protected void await(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS), "Latch did not open within 5 seconds");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch");
        }
    }
}
