package com.ryuqq.lifecycle.core.outcome;

/**
 * 액션 실패.
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>{@link #ACTION_FAILED}: 핸들러가 예외를 던짐</li>
 *   <li>{@link #ACTION_TIMEOUT}: timeout_ms 경과</li>
 *   <li>{@link #ACTION_INTERRUPTED}: 호출 스레드가 대기 중 인터럽트됨</li>
 *   <li>{@link #NO_HANDLER}: action_type에 등록된 핸들러 없음</li>
 * </ul>
 *
 * @param actionName 액션 이름
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionFailure(
    String actionName,
    String errorCode,
    String message,
    String cause
) implements ActionOutcome {

    public static final String ACTION_FAILED = "ACTION_FAILED";
    public static final String ACTION_TIMEOUT = "ACTION_TIMEOUT";
    public static final String ACTION_INTERRUPTED = "ACTION_INTERRUPTED";
    public static final String NO_HANDLER = "NO_HANDLER";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException actionName, errorCode, message가 null이거나 빈 문자열인 경우
     */
    public ActionFailure {
        if (actionName == null || actionName.isBlank()) {
            throw new IllegalArgumentException("actionName cannot be null or blank");
        }
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static ActionFailure of(String actionName, String errorCode, String message) {
        return new ActionFailure(actionName, errorCode, message, null);
    }

    public static ActionFailure of(String actionName, String errorCode, String message, String cause) {
        return new ActionFailure(actionName, errorCode, message, cause);
    }

    /**
     * 타임아웃 실패 생성.
     *
     * @param actionName 액션 이름
     * @param timeoutMs 초과한 기한
     * @return ActionFailure
     */
    public static ActionFailure timeout(String actionName, long timeoutMs) {
        return new ActionFailure(actionName, ACTION_TIMEOUT,
            "Action '" + actionName + "' did not complete within " + timeoutMs + "ms", null);
    }

    public boolean timedOut() {
        return ACTION_TIMEOUT.equals(errorCode);
    }
}
