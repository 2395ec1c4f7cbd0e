package com.ryuqq.lifecycle.adapter.runner.handler;

import com.ryuqq.lifecycle.core.executor.ActionContext;
import com.ryuqq.lifecycle.core.model.ActionDefinition;
import com.ryuqq.lifecycle.core.spi.ActionHandler;
import com.ryuqq.lifecycle.core.spi.ResourceReleaser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code cleanup} 액션 핸들러.
 *
 * <p>이미 해제되었거나 등록되지 않은 자원은 no-op입니다.</p>
 *
 * <p>action_config: {@code resource} (기본: 인스턴스 이름)</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CleanupActionHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(CleanupActionHandler.class);

    private final ResourceReleaser resourceReleaser;

    public CleanupActionHandler(ResourceReleaser resourceReleaser) {
        if (resourceReleaser == null) {
            throw new IllegalArgumentException("resourceReleaser cannot be null");
        }
        this.resourceReleaser = resourceReleaser;
    }

    @Override
    public void handle(ActionDefinition action, ActionContext context) {
        String resource = action.configString("resource", context.instanceName());
        if (resourceReleaser.release(resource)) {
            log.info("Released {} for {}", resource, context.instanceName());
        } else {
            log.debug("Resource {} already released", resource);
        }
    }
}
