/**
 * Contract document parsing and analysis.
 *
 * <p>Turns a raw document tree ({@code Map<String, Object>} as produced by a YAML or JSON
 * reader) into a validated {@link com.ryuqq.lifecycle.core.model.Contract}. Nothing here
 * touches the filesystem; discovery belongs to a
 * {@link com.ryuqq.lifecycle.core.spi.ContractSource}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.contract.ContractDocument} - raw document with its source id</li>
 *   <li>{@link com.ryuqq.lifecycle.core.contract.ContractParser} - field checks, then cross-reference checks</li>
 *   <li>{@link com.ryuqq.lifecycle.core.contract.ContractAnalyzer} - unreachable and dead-end state warnings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.contract;
