package com.ryuqq.lifecycle.application.orchestrator;

import com.ryuqq.lifecycle.core.error.LifecycleException;
import com.ryuqq.lifecycle.core.error.SchemaException;
import com.ryuqq.lifecycle.core.error.TransitionAbortedException;

/**
 * 시작 시퀀스 실패.
 *
 * <p>운영자가 바로 조치할 수 있도록 문제가 된 계약과 (있다면) 액션을 식별합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StartupException extends LifecycleException {

    public static final String ERROR_CODE = "STARTUP-001";

    private final String contractName;
    private final String actionName;

    /**
     * 생성자.
     *
     * @param contractName 문제가 된 계약 (또는 인스턴스) 이름
     * @param actionName 문제가 된 액션 이름 (null 가능)
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     */
    public StartupException(String contractName, String actionName, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.contractName = contractName;
        this.actionName = actionName;
    }

    /**
     * 치명 액션 실패로부터 생성.
     *
     * @param e 중단 예외
     * @return StartupException
     */
    public static StartupException aborted(TransitionAbortedException e) {
        String action = e.getResult().failure().actionName();
        return new StartupException(e.getInstanceName(), action,
            String.format("Startup failed: critical action '%s' of %s failed: %s",
                action, e.getInstanceName(), e.getResult().failure().message()),
            e);
    }

    /**
     * 계약 검증 실패로부터 생성.
     *
     * @param e 스키마 예외
     * @return StartupException
     */
    public static StartupException invalidContract(SchemaException e) {
        return new StartupException(e.getSource(), null,
            "Startup failed: " + e.getMessage(), e);
    }

    public String getContractName() {
        return contractName;
    }

    public String getActionName() {
        return actionName;
    }
}
