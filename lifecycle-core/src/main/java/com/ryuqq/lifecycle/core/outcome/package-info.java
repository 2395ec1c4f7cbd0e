/**
 * Action outcome types.
 *
 * <p>{@link com.ryuqq.lifecycle.core.outcome.ActionOutcome} is sealed: an action either
 * succeeded or failed. Timeouts are failures with code
 * {@link com.ryuqq.lifecycle.core.outcome.ActionFailure#ACTION_TIMEOUT}; whether a failure
 * aborts the transition depends only on the action's {@code is_critical} flag.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.outcome;
