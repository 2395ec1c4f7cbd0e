package com.ryuqq.lifecycle.adapter.yaml.cache;

/**
 * 계약 문서 캐시 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ttlMs: 항목 유효 시간 (기본 60000ms = 1분, 0이면 캐시 비활성화)</li>
 *   <li>maxEntries: 최대 항목 수 (기본 256, 초과 시 가장 오래된 항목 제거)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param ttlMs 항목 유효 시간 (밀리초, 0 이상)
 * @param maxEntries 최대 항목 수 (1 이상)
 */
public record ContractCacheConfig(long ttlMs, int maxEntries) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: ttlMs=60000ms (1분), maxEntries=256</p>
     */
    public ContractCacheConfig() {
        this(60000, 256);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ContractCacheConfig {
        if (ttlMs < 0) {
            throw new IllegalArgumentException(
                "ttlMs must not be negative (current: " + ttlMs + ")"
            );
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException(
                "maxEntries must be positive (current: " + maxEntries + ")"
            );
        }
    }

    public boolean enabled() {
        return ttlMs > 0;
    }

    /**
     * ttlMs만 변경한 새 인스턴스 생성.
     */
    public ContractCacheConfig withTtlMs(long ttlMs) {
        return new ContractCacheConfig(ttlMs, maxEntries);
    }

    /**
     * maxEntries만 변경한 새 인스턴스 생성.
     */
    public ContractCacheConfig withMaxEntries(int maxEntries) {
        return new ContractCacheConfig(ttlMs, maxEntries);
    }
}
