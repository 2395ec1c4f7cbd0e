package com.ryuqq.lifecycle.core.error;

import com.ryuqq.lifecycle.core.statemachine.TransitionResult;

/**
 * 중요(critical) 액션 실패로 전이가 중단되었음을 오케스트레이터에게 알리는 예외.
 *
 * <p>소스 상태는 그대로 유지되며, 롤백 결과를 포함한 중단 결과를 함께 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransitionAbortedException extends LifecycleException {

    public static final String ERROR_CODE = "FSM-500";

    private final String instanceName;
    private final TransitionResult.Aborted result;

    /**
     * 생성자.
     *
     * @param instanceName 인스턴스 이름
     * @param result 중단된 전이 결과
     * @throws IllegalArgumentException result가 null인 경우
     */
    public TransitionAbortedException(String instanceName, TransitionResult.Aborted result) {
        super(ERROR_CODE, describe(instanceName, result), null);
        this.instanceName = instanceName;
        this.result = result;
    }

    private static String describe(String instanceName, TransitionResult.Aborted result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return String.format("Transition %s on %s aborted by critical action '%s': %s",
            result.transition().name(),
            instanceName,
            result.failure().actionName(),
            result.failure().message());
    }

    public String getInstanceName() {
        return instanceName;
    }

    public TransitionResult.Aborted getResult() {
        return result;
    }
}
