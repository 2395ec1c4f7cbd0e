/**
 * In-memory snapshot and diagnostic stores.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.store;
