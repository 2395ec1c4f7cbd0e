package com.ryuqq.lifecycle.core.statemachine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 상태 변경을 SLF4J로 기록하는 리스너.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Slf4jLifecycleListener implements LifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(Slf4jLifecycleListener.class);

    @Override
    public void onStateChanged(FsmInstance instance, StateChangedEvent event) {
        if (instance.isTerminal()) {
            log.warn("Instance {} reached terminal state {} from {} (event={}, generation={}, correlationId={})",
                event.instanceName(), event.toState(), event.fromState(),
                event.event(), event.generation(), event.correlationId());
        } else {
            log.info("Instance {} changed state: {} -> {} (event={}, generation={}, correlationId={})",
                event.instanceName(), event.fromState(), event.toState(),
                event.event(), event.generation(), event.correlationId());
        }
    }
}
