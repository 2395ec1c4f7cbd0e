package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.EventBus;

import java.util.Map;

/**
 * {@code event} 액션 핸들러.
 *
 * <p>action_config:</p>
 * <ul>
 *   <li>{@code event_name}: 발행할 이벤트 이름 (기본: 액션 이름)</li>
 *   <li>{@code topic_tier}: {@code command}이면 명령 토픽, 그 외에는 관측 토픽</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class EventActionHandler implements ActionHandler {

    private final EventBus eventBus;

    public EventActionHandler(EventBus eventBus) {
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        this.eventBus = eventBus;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        String tier = action.configString("topic_tier", "observability");
        String topic = TopicNames.COMMAND_TIER.equalsIgnoreCase(tier)
            ? TopicNames.commands(context.instanceName())
            : TopicNames.events(context.instanceName());

        Map<String, Object> payload = ActionPayloads.of(action, context);
        eventBus.publish(topic, action.configString("event_name", action.name()), payload);
    }
}
