package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;

/**
 * Side-effect implementation for one {@code action_type}.
 *
 * <p>Handlers are passed explicitly to the action executor keyed by
 * {@link com.ryuqq.lifecycle.core.model.ActionType}; there is no global lookup.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Report failure by throwing; returning normally means success</li>
 *   <li>Respond to thread interruption, since timeouts cancel the running handler</li>
 *   <li>Do not retry internally unless the action's own semantics require it</li>
 *   <li>Handlers used by terminal-state entry actions must be idempotent</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ActionHandler {

    /**
     * Performs the action's side effect.
     *
     * @param action the action definition, including its {@code action_config}
     * @param context the transition context the action runs in
     * @throws Exception if the side effect failed
     */
    void handle(ActionDefinition action, ActionContext context) throws Exception;
}
