package com.urlsentry.core.service;

import com.urlsentry.core.api.IClassifier;
import com.urlsentry.core.api.IFetcher;
import com.urlsentry.core.cache.AnalysisCache;
import com.urlsentry.core.http.CountingRetryPolicy;
import com.urlsentry.core.http.RetryPolicy;
import com.urlsentry.core.model.AnalysisRequest;
import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.EngineStats;
import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.signature.SignatureCatalog;
import com.urlsentry.core.signature.SignatureCatalogHolder;
import com.urlsentry.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * URL 1건 처리: Cache → Fetcher(+재시도) → Classifier → Cache put.
 * 요청의 normalizedUrl이 캐시 키, target이 실제 페치 대상이다.
 * 실패한 페치 결과는 캐시하지 않는다.
 */
public final class AnalysisPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final AnalysisCache cache;
    private final IFetcher fetcher;
    private final IClassifier classifier;
    private final SignatureCatalogHolder catalogs;
    private final EngineStats stats;
    private final Sleeper sleeper;

    public AnalysisPipeline(AnalysisCache cache, IFetcher fetcher, IClassifier classifier,
                            SignatureCatalogHolder catalogs, EngineStats stats, Sleeper sleeper) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** fromCache: 캐시 적중 여부, retries: 실제 재시도 횟수 */
    public record Outcome(AnalysisResult result, boolean fromCache, int retries) {}

    public Outcome run(AnalysisRequest request, RetryPolicy policy, AtomicBoolean cancel) throws InterruptedException {
        Objects.requireNonNull(request, "request");
        String key = request.normalizedUrl();

        var cached = cache.get(key);
        if (cached.isPresent()) {
            stats.recordCacheHit();
            return new Outcome(cached.get(), true, 0);
        }
        stats.recordCacheMiss();

        CountingRetryPolicy counting = new CountingRetryPolicy(policy == null ? RetryPolicy.NONE : policy);
        FetchResult fetch = fetchWithRetry(request.target(), counting, cancel);

        // 분석 1건은 시작 시점의 카탈로그 하나로 끝까지 진행
        SignatureCatalog catalog = catalogs.current();
        AnalysisResult result = classifier.classify(fetch, catalog);

        if (!result.isFetchFailed()) {
            result = result.withTtlSeconds(cache.getDefaultTtl().getSeconds());
            cache.put(key, result);
        }
        LOG.debug("Analyzed {} for {} (requested {}): {}",
                key, request.requester().requesterId(), request.requestedAt(), result.getVerdict());
        return new Outcome(result, false, counting.getRetryCount());
    }

    private FetchResult fetchWithRetry(URI url, CountingRetryPolicy policy, AtomicBoolean cancel)
            throws InterruptedException {
        int attempt = 1;
        while (true) {
            FetchResult r = fetcher.fetch(url);
            stats.recordFetch(r.getElapsedMs());
            if (r.isSuccess() || !policy.shouldRetry(r.getOutcome(), attempt)) {
                return r;
            }
            stats.recordRetry();
            LOG.debug("Retry #{} for {} after {}: {}", attempt, url, r.getOutcome(), r.getErrorMessage());
            sleeper.sleep(policy.nextDelay(attempt));
            if (cancel != null && cancel.get()) throw new CancellationException("batch cancelled");
            attempt++;
        }
    }
}
