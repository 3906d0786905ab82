package com.urlsentry.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). 엔진이 생성해 워커들에 주입한다. */
public final class EngineStats {
    private final AtomicLong fetchesTotal = new AtomicLong(0);       // 실제 네트워크 페치(재시도 포함)
    private final AtomicLong retriesTotal = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);           // 실패로 끝난 URL 단위
    private final AtomicLong sumFetchMs = new AtomicLong(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void recordFetch(long elapsedMs) {
        fetchesTotal.incrementAndGet();
        sumFetchMs.addAndGet(Math.max(0, elapsedMs));
    }
    public void recordRetry() { retriesTotal.incrementAndGet(); }
    public void recordCacheHit() { cacheHits.incrementAndGet(); }
    public void recordCacheMiss() { cacheMisses.incrementAndGet(); }
    public void recordFailure() { failures.incrementAndGet(); }

    /** 유닛 시작 시 호출, 현재 동시 실행 수 반환 */
    public int enter() {
        int cur = inFlight.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
        return cur;
    }
    public void exit() { inFlight.decrementAndGet(); }

    public Snapshot snapshot() {
        long fetches = fetchesTotal.get();
        long avg = (fetches == 0) ? 0 : sumFetchMs.get() / fetches;
        return new Snapshot(fetches, retriesTotal.get(), cacheHits.get(), cacheMisses.get(),
                failures.get(), maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 */
    public record Snapshot(long fetchesTotal, long retriesTotal, long cacheHits, long cacheMisses,
                           long failures, int maxObservedConcurrency, long avgFetchMs) {}
}
