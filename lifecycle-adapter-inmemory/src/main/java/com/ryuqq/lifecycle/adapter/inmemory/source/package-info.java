/**
 * In-memory contract source.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.source;
