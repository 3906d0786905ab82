package com.urlsentry.core.service;

import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.persistence.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/** 요청자별 사용량 카운터(metrics 컬렉션). 기록 실패는 분석 결과에 영향을 주지 않는다. */
public final class UsageRecorder {
    private static final Logger LOG = LoggerFactory.getLogger(UsageRecorder.class);

    public static final String ANALYSES = "analyses";
    public static final String CACHE_HITS = "cacheHits";
    public static final String FAILURES = "failures";

    private final StorageBackend storage;

    public UsageRecorder(StorageBackend storage) {
        this.storage = Objects.requireNonNull(storage, "storage");
    }

    public void record(String requesterId, boolean fromCache, boolean failed) {
        try {
            storage.incrementMetric(requesterId, ANALYSES, 1);
            if (fromCache) storage.incrementMetric(requesterId, CACHE_HITS, 1);
            if (failed) storage.incrementMetric(requesterId, FAILURES, 1);
        } catch (PersistenceException e) {
            LOG.warn("Usage metrics not recorded for {}: {}", requesterId, e.getMessage());
        }
    }

    public Map<String, Long> usageOf(String requesterId) {
        return storage.readMetrics(requesterId);
    }
}
