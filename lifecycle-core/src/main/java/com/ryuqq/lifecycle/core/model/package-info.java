/**
 * Contract model package.
 *
 * <p>Typed, immutable representation of a loaded lifecycle contract. Pure data:
 * the only behavior is lookup and build-time validation.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.model.Contract} - states, transitions, actions and dependencies of one node</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.StateDefinition} - state with ordered entry/exit action references</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.TransitionDefinition} - exact or wildcard ({@code *}) transition</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.ActionDefinition} - action type, criticality, timeout, rollback</li>
 *   <li>{@link com.ryuqq.lifecycle.core.model.ContractVersion} - semantic version with compatibility check</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <pre>
 * - every from_state/to_state names a declared state (from_state may be '*')
 * - exactly one initial state, at least one terminal state
 * - at most one transition per (from_state, trigger)
 * - every referenced action is declared once
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.model;
