package com.urlsentry.core.service;

import com.urlsentry.core.api.IClassifier;
import com.urlsentry.core.api.IFetcher;
import com.urlsentry.core.cache.AnalysisCache;
import com.urlsentry.core.entitlement.EntitlementGate;
import com.urlsentry.core.entitlement.EntitlementService;
import com.urlsentry.core.exception.EntitlementDeniedException;
import com.urlsentry.core.http.DefaultRetryPolicy;
import com.urlsentry.core.http.Fetcher;
import com.urlsentry.core.http.RetryPolicy;
import com.urlsentry.core.model.AnalysisRequest;
import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.AuthorizationDecision;
import com.urlsentry.core.model.EngineConfig;
import com.urlsentry.core.model.EngineStats;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.persistence.MigrationReport;
import com.urlsentry.core.persistence.PersistenceTier;
import com.urlsentry.core.persistence.StorageBackend;
import com.urlsentry.core.persistence.StorageStats;
import com.urlsentry.core.scanner.Classifier;
import com.urlsentry.core.signature.SignatureCatalog;
import com.urlsentry.core.signature.SignatureCatalogHolder;
import com.urlsentry.core.util.DefaultSleeper;
import com.urlsentry.core.util.EngineClock;
import com.urlsentry.core.util.Sleeper;
import com.urlsentry.core.util.StructuredLog;
import com.urlsentry.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 엔진 진입점(외부 인터페이스).
 *  - analyze: 권한 확인 → 정규화 → 파이프라인 → 사용량 기록
 *  - analyzeBatch: 권한 확인 후 배치 코디네이터에 위임
 *  - 초기화 순서: 저장 계층 → 캐시/게이트 → 페처/분류기 → 배치 코디네이터
 *  - DI 생성자는 테스트/플러그인 주입용
 */
public final class UrlSentryEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(UrlSentryEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(UrlSentryEngine.class);

    private final EngineConfig config;
    private final EngineClock clock;
    private final EngineStats stats = new EngineStats();
    private final StorageBackend storage;
    private final AnalysisCache cache;
    private final EntitlementGate gate;
    private final EntitlementService entitlements;
    private final UsageRecorder usage;
    private final IFetcher fetcher;
    private final SignatureCatalogHolder catalogs;
    private final AnalysisPipeline pipeline;
    private final BatchCoordinator coordinator;

    /** 기본 구현(설정 → 몽고/파일 저장 계층, 실제 HttpClient, 번들 또는 외부 카탈로그) */
    public static UrlSentryEngine open(EngineConfig config) {
        Objects.requireNonNull(config, "config").validate();
        PersistenceTier tier = PersistenceTier.open(config.storage());
        try {
            SignatureCatalogHolder catalogs = SignatureCatalogHolder.open(config.getSignaturesPath());
            return new UrlSentryEngine(config, tier, new Fetcher(config), new Classifier(), catalogs,
                    EngineClock.SYSTEM, new DefaultSleeper(),
                    new DefaultRetryPolicy(config.batch().getRetryAttempts(), config.batch().getRetryBaseMillis()));
        } catch (RuntimeException e) {
            tier.close();
            throw e;
        }
    }

    /** DI/테스트/플러그인용 */
    public UrlSentryEngine(EngineConfig config, StorageBackend storage, IFetcher fetcher, IClassifier classifier,
                           SignatureCatalogHolder catalogs, EngineClock clock, Sleeper sleeper,
                           RetryPolicy batchRetry) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.clock = Objects.requireNonNull(clock, "clock");

        // 1) 저장 계층
        this.storage = Objects.requireNonNull(storage, "storage");
        // 2) 캐시/게이트
        this.cache = new AnalysisCache(storage, clock, config.getCacheTtl());
        this.gate = new EntitlementGate(storage, clock);
        this.entitlements = new EntitlementService(storage, clock);
        this.usage = new UsageRecorder(storage);
        // 3) 페처/분류기
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
        this.pipeline = new AnalysisPipeline(cache, fetcher, Objects.requireNonNull(classifier, "classifier"),
                catalogs, stats, sleeper);
        // 4) 배치 코디네이터
        this.coordinator = new BatchCoordinator(pipeline, batchRetry, usage, stats, clock, config.batch().getWorkers());

        LOG.info("Engine ready: storage={}, catalog={}, workers={}",
                storage.name(), catalogs.current().getVersion(), config.batch().getWorkers());
        SLOG.info("engine-ready",
                "storage", storage.name(),
                "catalog", catalogs.current().getVersion(),
                "rules", catalogs.current().size(),
                "workers", config.batch().getWorkers());
    }

    /* =========================
       분석 API
       ========================= */

    /**
     * URL 1건 분석. 권한 거부는 EntitlementDeniedException, 잘못된 URL은 MalformedUrlException.
     * 페치 실패는 예외가 아니라 status=FETCH_FAILED 결과로 돌려준다(재시도 없음).
     */
    public AnalysisResult analyze(String url, RequesterContext requester) {
        requireAllowed(requester);
        AnalysisRequest request = AnalysisRequest.of(UrlNormalizer.parse(url), requester, clock.now());
        stats.enter();
        try {
            AnalysisPipeline.Outcome out = pipeline.run(request, RetryPolicy.NONE, null);
            boolean failed = out.result().isFetchFailed();
            if (failed) stats.recordFailure();
            usage.record(requester.requesterId(), out.fromCache(), failed);
            return out.result();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while analyzing " + url);
        } finally {
            stats.exit();
        }
    }

    /** 배치 제출. 권한은 제출 시점에 한 번 확인한다. */
    public BatchHandle analyzeBatch(List<String> urls, RequesterContext requester, BatchListener listener) {
        requireAllowed(requester);
        return coordinator.submit(urls, requester, listener);
    }

    public AuthorizationDecision checkEntitlement(RequesterContext requester) {
        return gate.authorize(requester);
    }

    private void requireAllowed(RequesterContext requester) {
        Objects.requireNonNull(requester, "requester");
        AuthorizationDecision d = gate.authorize(requester);
        if (!d.allowed()) {
            SLOG.info("entitlement-denied", "requester", requester.requesterId(), "reason", d.reason());
            throw new EntitlementDeniedException(d.reason(), requester.requesterId());
        }
    }

    /* =========================
       관리/운영
       ========================= */

    public EntitlementService entitlements() { return entitlements; }

    public Map<String, Long> usageOf(String requesterId) { return usage.usageOf(requesterId); }

    public EngineStats.Snapshot runtimeStats() { return stats.snapshot(); }

    public StorageStats storageStats() { return storage.stats(); }

    public String storageBackend() { return storage.name(); }

    /** 만료된 캐시/구독 정리. 삭제 건수 반환 */
    public long vacuum() {
        long removed = storage.vacuum(clock.now());
        LOG.info("Vacuum removed {} expired records", removed);
        return removed;
    }

    /** 로컬 파일 → 현재 저장소로 복사 (현재 저장소가 PersistenceTier일 때) */
    public MigrationReport migrateFrom(Path dir) {
        if (storage instanceof PersistenceTier tier) return tier.migrateFrom(dir);
        throw new IllegalStateException("storage " + storage.name() + " does not support migration");
    }

    public SignatureCatalog reloadSignatures(Path path) {
        return catalogs.reload(path);
    }

    public SignatureCatalog currentCatalog() { return catalogs.current(); }

    public EngineConfig getConfig() { return config; }

    @Override
    public void close() {
        coordinator.close();
        try {
            fetcher.close();
        } finally {
            storage.close();
        }
    }
}
