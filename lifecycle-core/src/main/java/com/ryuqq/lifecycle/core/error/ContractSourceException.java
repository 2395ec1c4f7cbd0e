package com.ryuqq.lifecycle.core.error;

/**
 * 계약 저장소에서 문서를 찾거나 읽지 못한 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContractSourceException extends LifecycleException {

    public static final String ERROR_CODE = "SOURCE-001";

    public ContractSourceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    public ContractSourceException(String message) {
        this(message, null);
    }
}
