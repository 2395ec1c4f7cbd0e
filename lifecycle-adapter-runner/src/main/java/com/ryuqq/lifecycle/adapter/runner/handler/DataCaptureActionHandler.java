package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.DiagnosticStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code data_capture} 액션 핸들러.
 *
 * <p>진단 정보를 {@code <instance>:<target state>} 키로 한 번만 기록합니다.
 * 이미 있는 키는 무시되므로 같은 상태로 다시 진입해도 부수 효과가 늘지 않습니다.
 * 상관관계 ID는 키가 아니라 기록 내용에 남습니다.</p>
 *
 * <p>action_config: {@code key_prefix} (기본: 인스턴스 이름)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DataCaptureActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(DataCaptureActionHandler.class);

    private final DiagnosticStore diagnosticStore;

    public DataCaptureActionHandler(DiagnosticStore diagnosticStore) {
        if (diagnosticStore == null) {
            throw new IllegalArgumentException("diagnosticStore cannot be null");
        }
        this.diagnosticStore = diagnosticStore;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        String key = keyFor(action, context);
        if (!diagnosticStore.capture(key, ActionPayloads.of(action, context))) {
            log.debug("Diagnostic {} already captured, skipping", key);
        }
    }

    static String keyFor(ActionDefinition action, ActionContext context) {
        return action.configString("key_prefix", context.instanceName()) + ":" + context.targetState();
    }
}
