package com.ryuqq.lifecycle.adapter.yaml.cache;

import com.ryuqq.lifecycle.core.contract.ContractDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 파싱된 계약 문서 TTL 캐시.
 *
 * <p>항목은 파일 경로로 식별되며, 다음 경우에 다시 읽습니다:</p>
 * <ul>
 *   <li>TTL이 지난 경우</li>
 *   <li>파일 수정 시각이 캐시된 시각과 다른 경우</li>
 * </ul>
 *
 * <p>최대 항목 수를 넘으면 가장 먼저 적재된 항목부터 제거합니다.
 * 모든 연산은 인스턴스 모니터로 직렬화됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContractDocumentCache {

    private static final Logger log = LoggerFactory.getLogger(ContractDocumentCache.class);

    private final ContractCacheConfig config;
    private final Clock clock;
    private final Map<Path, Entry> entries = new LinkedHashMap<>();

    private long hits;
    private long misses;
    private long evictions;

    public ContractDocumentCache(ContractCacheConfig config) {
        this(config, Clock.systemUTC());
    }

    public ContractDocumentCache(ContractCacheConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    /**
     * 캐시된 문서 조회, 없거나 만료되었으면 loader로 적재.
     *
     * <p>loader 예외는 그대로 전파되며 캐시에 아무것도 남기지 않습니다.</p>
     *
     * @param file 문서 파일 경로
     * @param lastModified 현재 파일 수정 시각
     * @param loader 문서 적재 함수
     * @return 문서
     */
    public synchronized ContractDocument getOrLoad(Path file, FileTime lastModified, Supplier<ContractDocument> loader) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }

        long now = clock.millis();
        Entry cached = entries.get(file);
        if (cached != null && cached.isFresh(now, config.ttlMs(), lastModified)) {
            hits++;
            return cached.document();
        }

        misses++;
        ContractDocument document = loader.get();
        if (!config.enabled()) {
            return document;
        }

        entries.remove(file);
        entries.put(file, new Entry(document, lastModified, now));
        evictOverflow();
        return document;
    }

    /**
     * 특정 파일 항목 제거.
     *
     * @param file 문서 파일 경로
     * @return 제거된 항목이 있었으면 true
     */
    public synchronized boolean invalidate(Path file) {
        return entries.remove(file) != null;
    }

    public synchronized void invalidateAll() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * 누적 통계.
     *
     * @return 현재 통계 스냅샷
     */
    public synchronized CacheStats stats() {
        return new CacheStats(hits, misses, evictions, entries.size());
    }

    public ContractCacheConfig config() {
        return config;
    }

    private void evictOverflow() {
        var iterator = entries.entrySet().iterator();
        while (entries.size() > config.maxEntries() && iterator.hasNext()) {
            Path evicted = iterator.next().getKey();
            iterator.remove();
            evictions++;
            log.debug("Evicted cached contract document {}", evicted);
        }
    }

    private record Entry(ContractDocument document, FileTime lastModified, long loadedAt) {

        boolean isFresh(long now, long ttlMs, FileTime currentModified) {
            if (now - loadedAt >= ttlMs) {
                return false;
            }
            return lastModified == null ? currentModified == null : lastModified.equals(currentModified);
        }
    }

    /**
     * 캐시 통계.
     *
     * @param hits 적중 횟수
     * @param misses 미스 횟수 (적재 횟수)
     * @param evictions 용량 초과로 제거된 항목 수
     * @param size 현재 항목 수
     */
    public record CacheStats(long hits, long misses, long evictions, int size) {

        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
