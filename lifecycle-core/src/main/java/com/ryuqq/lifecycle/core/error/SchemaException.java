package com.ryuqq.lifecycle.core.error;

import java.util.List;

/**
 * 계약(Contract) 구조/교차 참조 검증 실패.
 *
 * <p>로드 시점에만 발생하며, 런타임(전이 실행 중)에는 절대 발생하지 않습니다.
 * 하나의 문서에서 발견된 위반 사항을 모두 모아서 보고합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchemaException extends LifecycleException {

    public static final String ERROR_CODE = "SCHEMA-001";

    private final String source;
    private final List<String> violations;

    /**
     * 생성자.
     *
     * @param source 계약 출처 (파일 경로 등, null 가능)
     * @param violations 위반 사항 목록 (비어 있으면 안 됨)
     * @throws IllegalArgumentException violations가 null이거나 비어 있는 경우
     */
    public SchemaException(String source, List<String> violations) {
        super(ERROR_CODE, buildMessage(source, violations), null);
        this.source = source;
        this.violations = List.copyOf(violations);
    }

    /**
     * 단일 위반 사항으로 생성.
     *
     * @param source 계약 출처 (null 가능)
     * @param violation 위반 사항
     */
    public SchemaException(String source, String violation) {
        this(source, List.of(violation));
    }

    private static String buildMessage(String source, List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("violations cannot be null or empty");
        }
        String prefix = source == null ? "Invalid contract" : "Invalid contract [" + source + "]";
        return prefix + ": " + String.join("; ", violations);
    }

    /**
     * 출처 정보를 채운 새 예외 생성.
     *
     * @param source 계약 출처
     * @return 동일한 위반 사항을 가진 새 SchemaException
     */
    public SchemaException withSource(String source) {
        return new SchemaException(source, violations);
    }

    public String getSource() {
        return source;
    }

    public List<String> getViolations() {
        return violations;
    }
}
