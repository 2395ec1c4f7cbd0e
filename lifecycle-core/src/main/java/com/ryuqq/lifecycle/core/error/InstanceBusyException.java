package com.ryuqq.lifecycle.core.error;

/**
 * 동일 인스턴스에서 다른 전이가 진행 중일 때 이벤트가 전달된 경우.
 *
 * <p>이벤트는 큐에 쌓이지 않고 즉시 거절됩니다. 호출자가 재시도하거나 상위에서 큐잉해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InstanceBusyException extends LifecycleException {

    public static final String ERROR_CODE = "FSM-409";

    private final String instanceName;
    private final String event;

    public InstanceBusyException(String instanceName, String event) {
        super(ERROR_CODE,
            String.format("Instance %s is busy, event '%s' rejected", instanceName, event),
            null);
        this.instanceName = instanceName;
        this.event = event;
    }

    public String getInstanceName() {
        return instanceName;
    }

    public String getEvent() {
        return event;
    }
}
