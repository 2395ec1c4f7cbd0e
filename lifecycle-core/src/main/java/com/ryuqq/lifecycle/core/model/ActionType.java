package com.ryuqq.lifecycle.core.model;

import java.util.Locale;

/**
 * 액션의 부수 효과 종류.
 *
 * <p>각 종류는 외부 협력자(event bus, log sink, snapshot store 등)에 위임됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ActionType {

    /**
     * 이벤트 버스로 이벤트 발행.
     */
    EVENT("event"),

    /**
     * 구조화 로그 기록.
     */
    LOGGING("logging"),

    /**
     * 상태 스냅샷 영속화.
     */
    PERSISTENCE("persistence"),

    /**
     * 진단 데이터 캡처 (write-once).
     */
    DATA_CAPTURE("data_capture"),

    /**
     * 알림/페이징.
     */
    ALERT("alert"),

    /**
     * 소유 리소스 해제.
     */
    CLEANUP("cleanup");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 계약 문서에서 사용하는 이름.
     *
     * @return wire name (예: data_capture)
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 계약 문서 값으로 ActionType 조회.
     *
     * @param value action_type 값
     * @return ActionType
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ActionType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action_type cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action_type: " + value);
    }
}
