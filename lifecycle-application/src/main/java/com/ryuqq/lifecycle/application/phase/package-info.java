/**
 * Orchestrator phase model.
 *
 * <p>{@link com.ryuqq.lifecycle.application.phase.OrchestratorPhase} tracks the orchestrator
 * itself, separately from the contract-driven FSM instances it manages.
 * {@link com.ryuqq.lifecycle.application.phase.PhaseTransition} rejects illegal moves with
 * {@link java.lang.IllegalStateException}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.application.phase;
