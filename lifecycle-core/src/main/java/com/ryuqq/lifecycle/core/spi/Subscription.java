package com.ryuqq.lifecycle.core.spi;

/**
 * Handle for an event bus subscription.
 *
 * <p>Closing a subscription is idempotent.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    String topic();

    String subscriberId();

    boolean isActive();

    @Override
    void close();
}
