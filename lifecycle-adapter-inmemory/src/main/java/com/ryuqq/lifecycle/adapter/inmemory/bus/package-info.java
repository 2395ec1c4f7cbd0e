/**
 * In-memory event bus adapter.
 *
 * <p>Reference {@link com.ryuqq.lifecycle.core.spi.EventBus} that records publications and
 * subscriptions for inspection in tests.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.inmemory.bus;
