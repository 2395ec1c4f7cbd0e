package com.ryuqq.lifecycle.core.error;

/**
 * 복구 불가능한 인스턴스 수준 오류.
 *
 * <p>오케스트레이터는 이 오류를 받으면 모든 형제 인스턴스에 fatal 이벤트를 전파합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FatalLifecycleException extends LifecycleException {

    public static final String ERROR_CODE = "FSM-FATAL";

    private final String instanceName;

    public FatalLifecycleException(String instanceName, String message, Throwable cause) {
        super(ERROR_CODE, "Fatal error in " + instanceName + ": " + message, cause);
        this.instanceName = instanceName;
    }

    public String getInstanceName() {
        return instanceName;
    }
}
