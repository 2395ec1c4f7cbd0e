package com.ryuqq.lifecycle.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로더가 읽어 온 원시 계약 문서.
 *
 * <p>파일 탐색과 YAML/JSON 파싱은 로더 책임이며, 이 값은 이미 구조화된 트리만 담습니다.</p>
 *
 * @param sourceId 문서 출처 (파일 경로, 클래스패스 리소스 등)
 * @param content 문서 내용 (최상위 맵)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ContractDocument(String sourceId, Map<String, Object> content) {

    public ContractDocument {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null (source: " + sourceId + ")");
        }
        content = Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }
}
