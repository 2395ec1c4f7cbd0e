package com.ryuqq.lifecycle.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 계약에 한 번 정의되고, 상태/전이에서 이름으로 참조되는 액션.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>timeoutMs는 항상 양수</li>
 *   <li>rollbackAction은 같은 계약에 정의된 다른 액션 이름 (검증은 Contract 생성 시)</li>
 *   <li>config는 생성 후 변경 불가</li>
 * </ul>
 *
 * @param name 액션 이름 (소유 목록 내에서 유일)
 * @param type 액션 종류
 * @param critical 실패 시 전이를 중단해야 하는지 여부
 * @param timeoutMs 실행 기한 (밀리초, 양수)
 * @param version 호환성 확인용 버전
 * @param rollbackAction 보상 액션 이름 (null 가능)
 * @param config 액션별 설정 (null이면 빈 맵)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionDefinition(
    String name,
    ActionType type,
    boolean critical,
    long timeoutMs,
    ContractVersion version,
    String rollbackAction,
    Map<String, Object> config
) {

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 없거나 timeoutMs가 양수가 아닌 경우
     */
    public ActionDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action_name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("action_type cannot be null (action: " + name + ")");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException(
                "timeout_ms must be positive (action: " + name + ", current: " + timeoutMs + ")");
        }
        if (version == null) {
            throw new IllegalArgumentException("version cannot be null (action: " + name + ")");
        }
        if (rollbackAction != null && rollbackAction.isBlank()) {
            rollbackAction = null;
        }
        config = config == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(config));
    }

    /**
     * 기본값(non-critical, 5000ms, 1.0.0)으로 생성.
     *
     * @param name 액션 이름
     * @param type 액션 종류
     * @return ActionDefinition
     */
    public static ActionDefinition of(String name, ActionType type) {
        return new ActionDefinition(name, type, false, DEFAULT_TIMEOUT_MS, ContractVersion.of(1, 0, 0), null, null);
    }

    public boolean hasRollback() {
        return rollbackAction != null;
    }

    /**
     * 문자열 설정값 조회.
     *
     * @param key 설정 키
     * @param defaultValue 값이 없을 때 사용할 기본값
     * @return 설정값 또는 기본값
     */
    public String configString(String key, String defaultValue) {
        Object value = config.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    public ActionDefinition withCritical(boolean critical) {
        return new ActionDefinition(name, type, critical, timeoutMs, version, rollbackAction, config);
    }

    public ActionDefinition withTimeoutMs(long timeoutMs) {
        return new ActionDefinition(name, type, critical, timeoutMs, version, rollbackAction, config);
    }

    public ActionDefinition withRollbackAction(String rollbackAction) {
        return new ActionDefinition(name, type, critical, timeoutMs, version, rollbackAction, config);
    }

    public ActionDefinition withConfig(Map<String, Object> config) {
        return new ActionDefinition(name, type, critical, timeoutMs, version, rollbackAction, config);
    }
}
