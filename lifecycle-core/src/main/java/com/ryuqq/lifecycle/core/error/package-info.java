/**
 * Lifecycle error taxonomy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.error.SchemaException} - contract failed structural or cross-reference validation (load time only)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.InstanceBusyException} - event delivered while another transition is in flight</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.TransitionAbortedException} - a critical action failed, source state preserved</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.FatalLifecycleException} - unrecoverable instance-level condition</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.ContractSourceException} - contract documents could not be discovered or read</li>
 * </ul>
 *
 * <p>{@code NoMatch} is not an exception but a
 * {@link com.ryuqq.lifecycle.core.statemachine.TransitionResult} variant.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.error;
