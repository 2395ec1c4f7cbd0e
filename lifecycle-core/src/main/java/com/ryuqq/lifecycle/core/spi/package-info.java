/**
 * Service Provider Interfaces for lifecycle action side effects.
 *
 * <p>Each {@code action_type} is delegated to a named collaborator. Implementations are
 * passed explicitly into the runtime; the engine never looks them up.</p>
 *
 * <h2>Collaborators</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.EventBus} - {@code event} actions and wiring subscriptions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.SnapshotStore} - {@code persistence} actions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.DiagnosticStore} - {@code data_capture} actions (write-once)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.AlertNotifier} - {@code alert} actions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.ResourceReleaser} - {@code cleanup} actions</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.ContractSource} - contract discovery</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <pre>
 * - thread-safe: actions of different instances run concurrently
 * - idempotent where noted: terminal-state entry actions may run more than once
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.spi;
