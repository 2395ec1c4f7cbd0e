package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.adapter.runner.LifecycleCollaborators;
import com.ryuqq.lifecycle.core.model.ActionType;
import com.ryuqq.lifecycle.core.spi.ActionHandler;

import java.util.EnumMap;
import java.util.Map;

/**
 * 기본 액션 핸들러 구성.
 *
 * <p>모든 {@link ActionType}에 대해 외부 협력자를 사용하는 핸들러를 묶어 반환합니다.
 * 전역 레지스트리 없이 {@link com.ryuqq.lifecycle.adapter.runner.TimedActionExecutor}에
 * 명시적으로 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ActionHandlers {

    private ActionHandlers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 핸들러 맵 생성.
     *
     * @param collaborators 외부 협력자
     * @return 액션 종류별 핸들러 (수정 가능한 새 맵)
     */
    public static Map<ActionType, ActionHandler> defaults(LifecycleCollaborators collaborators) {
        if (collaborators == null) {
            throw new IllegalArgumentException("collaborators cannot be null");
        }
        Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);
        handlers.put(ActionType.EVENT, new EventActionHandler(collaborators.eventBus()));
        handlers.put(ActionType.LOGGING, new LoggingActionHandler());
        handlers.put(ActionType.PERSISTENCE, new PersistenceActionHandler(collaborators.snapshotStore()));
        handlers.put(ActionType.DATA_CAPTURE, new DataCaptureActionHandler(collaborators.diagnosticStore()));
        handlers.put(ActionType.ALERT, new AlertActionHandler(collaborators.alertNotifier()));
        handlers.put(ActionType.CLEANUP, new CleanupActionHandler(collaborators.resourceReleaser()));
        return handlers;
    }
}
