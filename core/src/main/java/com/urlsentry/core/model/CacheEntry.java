package com.urlsentry.core.model;

import java.time.Instant;
import java.util.Objects;

/** 정규화 URL → 분석 결과. storedAt + ttlSeconds 가 지나면 만료. */
public record CacheEntry(String key, AnalysisResult result, Instant storedAt, long ttlSeconds) {

    public CacheEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(storedAt, "storedAt");
        if (ttlSeconds < 0) throw new IllegalArgumentException("ttlSeconds must be >= 0");
    }

    public long expiresAtEpochMs() {
        return storedAt.toEpochMilli() + ttlSeconds * 1000L;
    }

    /** 만료 시점이 now 이하이면 만료 */
    public boolean isExpiredAt(long nowMillis) {
        return expiresAtEpochMs() <= nowMillis;
    }
}
