package com.ryuqq.lifecycle.testkit.contract;

import com.ryuqq.lifecycle.core.statemachine.FsmInstance;
import com.ryuqq.lifecycle.core.statemachine.TransitionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: exact and wildcard routing.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>An exact (state, event) route wins over a wildcard route for the same event</li>
 *   <li>Wildcard routes apply from every non-terminal state</li>
 *   <li>Terminal states absorb wildcard events but still honour exact routes</li>
 *   <li>Unknown events leave the instance untouched</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WildcardRoutingContractTest extends AbstractLifecycleContractTest {

    @Test
    void testExactRoute_TakesPrecedenceOverWildcard() {
        // Given
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());
        assertCommitted(apply(instance, "start"));

        // When
        TransitionResult.Committed committed = assertCommitted(apply(instance, "shutdown_requested"));

        // Then
        assertEquals("draining", committed.toState());
        assertFalse(committed.transition().isWildcard());
        assertState(instance, "draining", 2);
    }

    @Test
    void testWildcardRoute_AppliesWhenNoExactRouteExists() {
        // Given: idle has no exact shutdown_requested route
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());

        // When
        TransitionResult.Committed committed = assertCommitted(apply(instance, "shutdown_requested"));

        // Then
        assertTrue(committed.transition().isWildcard());
        assertEquals("idle", committed.fromState());
        assertState(instance, "stopped", 1);
    }

    @Test
    void testWildcardRoute_ReachesTerminalFromIntermediateState() {
        // Given
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());
        assertCommitted(apply(instance, "start"));
        assertCommitted(apply(instance, "shutdown_requested"));

        // When
        assertCommitted(apply(instance, "fatal_error"));

        // Then
        assertState(instance, "error", 3);
        assertTrue(instance.isTerminal());
        assertEquals(1, executor.count("capture_failure"));
    }

    @Test
    void testTerminalState_AbsorbsWildcardEvents() {
        // Given
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());
        assertCommitted(apply(instance, "shutdown_requested"));

        // When
        TransitionResult fatal = apply(instance, "fatal_error");
        TransitionResult again = apply(instance, "shutdown_requested");

        // Then
        assertNoMatch(fatal);
        assertNoMatch(again);
        assertState(instance, "stopped", 1);
        assertEquals(0, executor.count("capture_failure"));
    }

    @Test
    void testTerminalState_HonoursExactRoute() {
        // Given
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());
        assertCommitted(apply(instance, "fatal_error"));

        // When
        TransitionResult.Committed committed = assertCommitted(apply(instance, "recover"));

        // Then
        assertEquals("error", committed.fromState());
        assertState(instance, "idle", 2);
    }

    @Test
    void testUnknownEvent_NoMatchAndRemembered() {
        // Given
        FsmInstance instance = newInstance("graph", ContractFixtures.wildcardContract());

        // When
        TransitionResult result = instance.handle("unheard_of");

        // Then
        assertNoMatch(result);
        TransitionResult.NoMatch noMatch = (TransitionResult.NoMatch) result;
        assertEquals("idle", noMatch.state());
        assertEquals("unheard_of", noMatch.event());
        assertSame(result, instance.lastResult());
        assertState(instance, "idle", 0);
    }
}
