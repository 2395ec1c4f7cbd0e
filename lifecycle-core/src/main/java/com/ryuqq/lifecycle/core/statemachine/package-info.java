/**
 * Contract-driven state machine runtime.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionEngine} - interprets a contract for one event</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.FsmInstance} - contract plus current state, generation and in-transition flag</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.TransitionResult} - Committed, NoMatch or Aborted</li>
 *   <li>{@link com.ryuqq.lifecycle.core.statemachine.LifecycleListener} - {@code state_changed} notifications</li>
 * </ul>
 *
 * <h2>Guarantees</h2>
 * <pre>
 * - action order: exit(source) ++ transition ++ entry(target)
 * - critical failure leaves current_state at the source state
 * - generation grows by exactly 1 per commit, never on NoMatch or abort
 * - exact (state, event) match wins over a wildcard match
 * - wildcards never fire from a terminal state
 * - one transition in flight per instance; concurrent deliveries get Busy
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.statemachine;
