package com.urlsentry.core.service;

import com.urlsentry.core.exception.ErrorCode;
import com.urlsentry.core.exception.MalformedUrlException;
import com.urlsentry.core.exception.UrlSentryException;
import com.urlsentry.core.http.RetryPolicy;
import com.urlsentry.core.model.AnalysisRequest;
import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.EngineStats;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.util.EngineClock;
import com.urlsentry.core.util.StructuredLog;
import com.urlsentry.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 오케스트레이터:
 *  - URL마다 유닛 하나(Cache → Fetcher → Classifier → Cache put)
 *  - 고정 폭 워커 풀(모든 배치가 공유)로 동시 실행 수 제한
 *  - 유닛 실패(잘못된 URL, 페치 실패)는 실패 아이템이 되고 나머지는 계속 진행
 *  - 재시도 정책은 여기서만 적용(기본: NETWORK_ERROR만)
 *  - 취소는 협조적: 유닛 시작 전 확인, 취소 후 도착한 결과는 버린다
 */
public final class BatchCoordinator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BatchCoordinator.class);
    private static final StructuredLog SLOG = StructuredLog.get(BatchCoordinator.class);

    private final AnalysisPipeline pipeline;
    private final RetryPolicy retryPolicy;
    private final UsageRecorder usage;
    private final EngineStats stats;
    private final EngineClock clock;
    private final int workers;
    private final ThreadPoolExecutor exec;

    public BatchCoordinator(AnalysisPipeline pipeline, RetryPolicy retryPolicy, UsageRecorder usage,
                            EngineStats stats, EngineClock clock, int workers) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        this.workers = workers;
        // 큐는 무제한: 제출은 즉시 반환하고 폭은 스레드 수로 제한
        this.exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("batch-worker"));
    }

    public int getWorkers() { return workers; }

    /** 즉시 반환. 진행은 listener / handle.poll 로 받는다. */
    public BatchHandle submit(List<String> urls, RequesterContext requester, BatchListener listener) {
        Objects.requireNonNull(urls, "urls");
        Objects.requireNonNull(requester, "requester");
        BatchJob job = new BatchJob(UUID.randomUUID().toString(), urls, requester, listener);

        LOG.info("Batch start: id={}, urls={}, requester={}, workers={}",
                job.id(), job.total(), requester.requesterId(), workers);
        SLOG.info("batch-start",
                "batchId", job.id(),
                "total", job.total(),
                "requester", requester.requesterId(),
                "workers", workers);

        job.start();
        job.completion().thenAccept(s -> {
            LOG.info("Batch done: id={}, state={}, completed={}, failed={}, {}ms",
                    s.batchId(), s.state(), s.completed(), s.failed(), s.elapsedMs());
            SLOG.info("batch-done",
                    "batchId", s.batchId(),
                    "state", s.state(),
                    "completed", s.completed(),
                    "failed", s.failed(),
                    "abandoned", s.abandoned(),
                    "ms", s.elapsedMs());
        });

        for (int i = 0; i < urls.size(); i++) {
            UnitTask task = new UnitTask(job, i, urls.get(i));
            try {
                exec.execute(task);
            } catch (RejectedExecutionException e) {
                // 종료 중인 코디네이터: 나머지 유닛은 실행하지 않는다
                job.cancel();
                task.abandon();
            }
        }
        return new BatchHandle(job);
    }

    /** URL 1건 처리 단위 */
    private final class UnitTask implements Runnable {
        private final BatchJob job;
        private final int index;
        private final String url;

        UnitTask(BatchJob job, int index, String url) {
            this.job = job;
            this.index = index;
            this.url = url;
        }

        void abandon() {
            job.abandon();
        }

        @Override
        public void run() {
            if (job.isCancelled() || Thread.currentThread().isInterrupted()) {
                job.abandon();
                return;
            }
            boolean settled = false;
            stats.enter();
            try {
                job.record(process());
                settled = true;
            } catch (CancellationException ce) {
                job.abandon();
                settled = true;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                job.abandon();
                settled = true;
            } finally {
                stats.exit();
                if (!settled) {
                    // Error가 빠져나가도 유닛은 실패로 정산해야 await가 끝난다
                    LOG.error("Unit aborted: batch={}, url={}", job.id(), url);
                    stats.recordFailure();
                    job.record(BatchItem.failed(index, url, null, ErrorCode.CLASSIFICATION_ERROR, "unit aborted"));
                }
            }
        }

        private BatchItem process() throws InterruptedException {
            String requesterId = job.requester().requesterId();
            AnalysisRequest request;
            try {
                request = AnalysisRequest.of(UrlNormalizer.parse(url), job.requester(), clock.now());
            } catch (MalformedUrlException e) {
                return failed(null, ErrorCode.MALFORMED_URL, e.getMessage(), requesterId);
            }

            try {
                AnalysisPipeline.Outcome out = pipeline.run(request, retryPolicy, job.cancelFlag());
                AnalysisResult r = out.result();
                if (r.isFetchFailed()) {
                    return failed(r, r.getFetchError().outcome().errorCode(), r.getFetchError().message(), requesterId);
                }
                usage.record(requesterId, out.fromCache(), false);
                return BatchItem.success(index, url, r, out.fromCache());
            } catch (UrlSentryException e) {
                return failed(null, e.getErrorCode(), e.getMessage(), requesterId);
            } catch (CancellationException | InterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Unit failed unexpectedly: {} -> {}", url, e.toString());
                SLOG.error("unit-crashed", e, "batchId", job.id(), "url", url);
                return failed(null, ErrorCode.CLASSIFICATION_ERROR, e.toString(), requesterId);
            }
        }

        private BatchItem failed(AnalysisResult r, ErrorCode code, String message, String requesterId) {
            stats.recordFailure();
            usage.record(requesterId, false, true);
            SLOG.info("unit-failed", "batchId", job.id(), "url", url, "code", code.code(), "message", message);
            return BatchItem.failed(index, url, r, code, message);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /** 남은 유닛은 버리고 워커를 정리한다 */
    @Override
    public void close() {
        List<Runnable> pending = exec.shutdownNow();
        for (Runnable r : pending) {
            if (r instanceof UnitTask t) {
                t.job.cancel();
                t.abandon();
            }
        }
        try {
            if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Batch workers did not terminate within 30s");
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
