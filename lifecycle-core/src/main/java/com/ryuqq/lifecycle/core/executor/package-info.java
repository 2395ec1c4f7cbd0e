/**
 * Action Executor port.
 *
 * <p>The Transition Engine runs every action through an
 * {@link com.ryuqq.lifecycle.core.executor.ActionExecutor}. The timed, handler-dispatching
 * implementation lives in the runner adapter.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.executor;
