package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Locale;
import java.util.Map;

/**
 * {@code logging} 액션 핸들러.
 *
 * <p>SLF4J 구조화 로그로 기록합니다. 전이 정보는 key-value로 붙습니다.</p>
 *
 * <p>action_config:</p>
 * <ul>
 *   <li>{@code level}: trace, debug, info, warn, error (기본 info)</li>
 *   <li>{@code message}: 로그 메시지 (기본: "action &lt;name&gt; executed")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LoggingActionHandler implements ActionHandler {

    private final Logger sink;

    public LoggingActionHandler() {
        this(LoggerFactory.getLogger("com.ryuqq.lifecycle.actions"));
    }

    public LoggingActionHandler(Logger sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        Level level = parseLevel(action.configString("level", "info"));
        LoggingEventBuilder builder = sink.atLevel(level);
        for (Map.Entry<String, Object> field : ActionPayloads.of(action, context).entrySet()) {
            builder = builder.addKeyValue(field.getKey(), field.getValue());
        }
        builder.log(action.configString("message", "action " + action.name() + " executed"));
    }

    static Level parseLevel(String value) {
        try {
            return Level.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + value, e);
        }
    }
}
