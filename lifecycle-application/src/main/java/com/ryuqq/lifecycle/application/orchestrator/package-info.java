/**
 * Orchestrator port and its value types.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.LifecycleOrchestrator} - startup, shutdown, health</li>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.LifecycleContracts} - contracts of the loader, registry and node graph</li>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.HealthSummary} - per-instance snapshots plus an aggregate flag</li>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.StartupException} - names the offending contract and action</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.application.orchestrator;
