package com.ryuqq.lifecycle.core.model;

import java.util.Locale;

/**
 * 계약이 기술하는 노드의 종류.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum NodeType {

    ORCHESTRATOR_GENERIC,

    REDUCER_GENERIC,

    EFFECT_GENERIC,

    COMPUTE_GENERIC;

    /**
     * 문자열 값으로 NodeType 조회 (대소문자 무시).
     *
     * @param value 노드 타입 이름
     * @return NodeType
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static NodeType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("node_type cannot be null or blank");
        }
        try {
            return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown node_type: " + value, e);
        }
    }
}
