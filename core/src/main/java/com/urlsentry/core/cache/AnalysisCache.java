package com.urlsentry.core.cache;

import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.persistence.StorageBackend;
import com.urlsentry.core.util.EngineClock;
import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 정규화 URL → 분석 결과 캐시 (저장 계층 위의 read-through 뷰).
 * - storedAt + ttl <= now 이면 미스, 그 자리에서 지운다(지연 삭제)
 * - put은 마지막 쓰기가 이긴다
 * - 저장소 오류: get은 미스로, put은 로그 후 false
 */
public final class AnalysisCache {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisCache.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalysisCache.class);

    private final StorageBackend storage;
    private final EngineClock clock;
    private final Duration defaultTtl;

    public AnalysisCache(StorageBackend storage, EngineClock clock, Duration defaultTtl) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    }

    public Duration getDefaultTtl() { return defaultTtl; }

    public Optional<AnalysisResult> get(String normalizedUrl) {
        Optional<CacheEntry> entry;
        try {
            entry = storage.readCache(normalizedUrl);
        } catch (PersistenceException e) {
            LOG.warn("Cache read failed for {} (treated as miss): {}", normalizedUrl, e.getMessage());
            return Optional.empty();
        }
        if (entry.isEmpty()) return Optional.empty();

        CacheEntry e = entry.get();
        if (e.isExpiredAt(clock.nowMillis())) {
            try {
                storage.deleteCache(normalizedUrl);
            } catch (PersistenceException ex) {
                LOG.debug("Lazy eviction failed for {}: {}", normalizedUrl, ex.getMessage());
            }
            SLOG.debug("cache-expired", "key", normalizedUrl);
            return Optional.empty();
        }
        SLOG.debug("cache-hit", "key", normalizedUrl);
        return Optional.of(e.result());
    }

    public boolean put(String normalizedUrl, AnalysisResult result) {
        return put(normalizedUrl, result, defaultTtl);
    }

    /** 저장 성공 여부. 실패는 호출자에게 예외로 올리지 않는다. */
    public boolean put(String normalizedUrl, AnalysisResult result, Duration ttl) {
        Objects.requireNonNull(normalizedUrl, "normalizedUrl");
        Objects.requireNonNull(result, "result");
        long ttlSeconds = Math.max(0, (ttl == null ? defaultTtl : ttl).getSeconds());
        try {
            storage.writeCache(new CacheEntry(normalizedUrl, result, clock.now(), ttlSeconds));
            return true;
        } catch (PersistenceException e) {
            LOG.warn("Cache write failed for {}: {}", normalizedUrl, e.getMessage());
            SLOG.warn("cache-put-failed", "key", normalizedUrl, "cause", e.getMessage());
            return false;
        }
    }
}
