package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.AlertNotifier;
import com.ryuqq.lifecycle.core.spi.AlertSeverity;

/**
 * {@code alert} 액션 핸들러.
 *
 * <p>action_config:</p>
 * <ul>
 *   <li>{@code severity}: info, warning, critical (기본 warning)</li>
 *   <li>{@code message}: 알림 메시지 (기본: 이벤트와 대상 상태로 구성)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AlertActionHandler implements ActionHandler {

    private final AlertNotifier alertNotifier;

    public AlertActionHandler(AlertNotifier alertNotifier) {
        if (alertNotifier == null) {
            throw new IllegalArgumentException("alertNotifier cannot be null");
        }
        this.alertNotifier = alertNotifier;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        AlertSeverity severity = AlertSeverity.from(action.configString("severity", AlertSeverity.WARNING.name()));
        String message = action.configString("message",
            context.instanceName() + " received " + context.event() + " towards " + context.targetState());
        alertNotifier.raise(severity, context.instanceName(), message, ActionPayloads.of(action, context));
    }
}
