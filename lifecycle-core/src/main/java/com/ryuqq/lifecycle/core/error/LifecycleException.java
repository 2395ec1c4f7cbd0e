package com.ryuqq.lifecycle.core.error;

/**
 * 라이프사이클 런타임 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 운영자가 식별할 수 있는 오류 코드를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class LifecycleException extends RuntimeException {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: SCHEMA-001)
     * @param message 오류 메시지
     * @param cause 원인 (null 가능)
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    protected LifecycleException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드
     */
    public String getErrorCode() {
        return errorCode;
    }
}
