package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.SnapshotStore;

import java.util.Map;

/**
 * {@code persistence} 액션 핸들러.
 *
 * <p>전이 정보를 상태 스냅샷으로 저장합니다. 같은 키에 다시 저장하면 덮어씁니다.</p>
 *
 * <p>action_config: {@code key} (기본: 인스턴스 이름)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PersistenceActionHandler implements ActionHandler {

    private final SnapshotStore snapshotStore;

    public PersistenceActionHandler(SnapshotStore snapshotStore) {
        if (snapshotStore == null) {
            throw new IllegalArgumentException("snapshotStore cannot be null");
        }
        this.snapshotStore = snapshotStore;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        Map<String, Object> snapshot = ActionPayloads.of(action, context);
        snapshot.put("state", context.targetState());
        snapshotStore.save(action.configString("key", context.instanceName()), snapshot);
    }
}
