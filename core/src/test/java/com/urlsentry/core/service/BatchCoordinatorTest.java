package com.urlsentry.core.service;

import com.urlsentry.core.api.IFetcher;
import com.urlsentry.core.cache.AnalysisCache;
import com.urlsentry.core.exception.ErrorCode;
import com.urlsentry.core.http.DefaultRetryPolicy;
import com.urlsentry.core.model.EngineStats;
import com.urlsentry.core.model.FetchOutcome;
import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.persistence.FileStorageBackend;
import com.urlsentry.core.scanner.Classifier;
import com.urlsentry.core.signature.SignatureCatalogHolder;
import com.urlsentry.core.signature.SignatureCatalogLoader;
import com.urlsentry.core.support.FakeFetcher;
import com.urlsentry.core.support.Pages;
import com.urlsentry.core.util.EngineClock;
import com.urlsentry.core.util.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BatchCoordinatorTest {

    private static final RequesterContext ALICE = RequesterContext.individual("alice");
    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir Path dir;
    private final EngineStats stats = new EngineStats();
    private FileStorageBackend storage;
    private UsageRecorder usage;
    private BatchCoordinator coordinator;

    private BatchCoordinator coordinator(IFetcher fetcher, int workers) {
        storage = FileStorageBackend.open(dir);
        usage = new UsageRecorder(storage);
        AnalysisCache cache = new AnalysisCache(storage, EngineClock.SYSTEM, Duration.ofHours(1));
        AnalysisPipeline pipeline = new AnalysisPipeline(cache, fetcher, new Classifier(),
                new SignatureCatalogHolder(SignatureCatalogLoader.loadBundled()), stats, Sleeper.NONE);
        coordinator = new BatchCoordinator(pipeline, new DefaultRetryPolicy(2, 1), usage, stats, EngineClock.SYSTEM, workers);
        return coordinator;
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) coordinator.close();
    }

    private static FetchResult okPage(URI url) {
        return Pages.at(url.toString()).hardened().body("<p>ok</p>").ok();
    }

    @Test
    void one_timeout_among_five_is_partially_failed() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(u -> u.getHost().startsWith("slow")
                ? Pages.at(u.toString()).failed(FetchOutcome.TIMEOUT, "fetch exceeded 15000ms")
                : okPage(u));
        List<String> urls = List.of("https://a.example/", "https://b.example/", "https://slow.example/",
                "https://c.example/", "https://d.example/");

        BatchSummary s = coordinator(fetcher, 5).submit(urls, ALICE, null).await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.PARTIALLY_FAILED);
        assertThat(s.completed()).isEqualTo(4);
        assertThat(s.failed()).isEqualTo(1);
        BatchItem slow = s.items().stream().filter(i -> !i.isSuccess()).findFirst().orElseThrow();
        assertThat(slow.url()).isEqualTo("https://slow.example/");
        assertThat(slow.errorCode()).isEqualTo(ErrorCode.FETCH_TIMEOUT);
        assertThat(slow.result().isFetchFailed()).isTrue();
        // 타임아웃은 재시도하지 않는다
        assertThat(fetcher.callCount()).isEqualTo(5);

        assertThat(usage.usageOf("alice"))
                .containsEntry(UsageRecorder.ANALYSES, 5L)
                .containsEntry(UsageRecorder.FAILURES, 1L);
    }

    @Test
    void every_unit_emits_exactly_one_event_in_order() throws Exception {
        List<BatchProgress> pushed = Collections.synchronizedList(new ArrayList<>());
        BatchHandle h = coordinator(new FakeFetcher(BatchCoordinatorTest::okPage), 2)
                .submit(List.of("https://a.example/", "https://b.example/", "https://c.example/"), ALICE, pushed::add);

        List<BatchProgress> polled = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Optional<BatchProgress> p = h.poll(WAIT);
            assertThat(p).isPresent();
            polled.add(p.get());
        }
        BatchSummary s = h.await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.COMPLETED);
        assertThat(h.poll(Duration.ofMillis(50))).isEmpty();
        assertThat(pushed).hasSize(3);
        assertThat(polled).extracting(BatchProgress::completed).containsExactly(1, 2, 3);
        assertThat(polled).extracting(p -> p.item().index()).containsExactlyInAnyOrder(0, 1, 2);
        assertThat(polled.get(2).finished()).isEqualTo(3);
    }

    @Test
    void malformed_url_fails_alone() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(BatchCoordinatorTest::okPage);
        BatchSummary s = coordinator(fetcher, 2)
                .submit(List.of("not a url", "https://ok.example/"), ALICE, null)
                .await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.PARTIALLY_FAILED);
        BatchItem bad = s.items().stream().filter(i -> i.index() == 0).findFirst().orElseThrow();
        assertThat(bad.errorCode()).isEqualTo(ErrorCode.MALFORMED_URL);
        assertThat(bad.result()).isNull();
        assertThat(fetcher.callCount()).isEqualTo(1);
    }

    @Test
    void unit_escaping_with_an_error_still_settles_the_batch() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(u -> {
            if (u.getHost().startsWith("boom")) throw new StackOverflowError("regex blew the stack");
            return okPage(u);
        });
        BatchSummary s = coordinator(fetcher, 2)
                .submit(List.of("https://ok.example/", "https://boom.example/"), ALICE, null)
                .await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.PARTIALLY_FAILED);
        assertThat(s.completed()).isEqualTo(1);
        assertThat(s.failed()).isEqualTo(1);
        BatchItem aborted = s.items().stream().filter(i -> i.index() == 1).findFirst().orElseThrow();
        assertThat(aborted.errorCode()).isEqualTo(ErrorCode.CLASSIFICATION_ERROR);
    }

    @Test
    void network_error_is_retried_once() throws Exception {
        ConcurrentHashMap<URI, AtomicInteger> attempts = new ConcurrentHashMap<>();
        FakeFetcher flaky = new FakeFetcher(u -> attempts.computeIfAbsent(u, k -> new AtomicInteger()).incrementAndGet() == 1
                ? Pages.at(u.toString()).failed(FetchOutcome.NETWORK_ERROR, "connection reset")
                : okPage(u));

        BatchSummary s = coordinator(flaky, 1).submit(List.of("https://flaky.example/"), ALICE, null).await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.COMPLETED);
        assertThat(flaky.callCount()).isEqualTo(2);
        assertThat(stats.snapshot().retriesTotal()).isEqualTo(1);
    }

    @Test
    void network_error_gives_up_after_max_attempts() throws Exception {
        FakeFetcher down = new FakeFetcher(u -> Pages.at(u.toString()).failed(FetchOutcome.NETWORK_ERROR, "dns resolution failed"));
        BatchSummary s = coordinator(down, 1).submit(List.of("https://down.example/"), ALICE, null).await(WAIT);

        assertThat(s.failed()).isEqualTo(1);
        assertThat(s.items().get(0).errorCode()).isEqualTo(ErrorCode.FETCH_ERROR);
        assertThat(down.callCount()).isEqualTo(2);
    }

    @Test
    void second_batch_is_served_from_cache() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(BatchCoordinatorTest::okPage);
        BatchCoordinator c = coordinator(fetcher, 2);
        c.submit(List.of("https://a.example/"), ALICE, null).await(WAIT);
        BatchSummary again = c.submit(List.of("https://A.example"), ALICE, null).await(WAIT);

        assertThat(again.items().get(0).fromCache()).isTrue();
        assertThat(fetcher.callCount()).isEqualTo(1);
        assertThat(usage.usageOf("alice")).containsEntry(UsageRecorder.CACHE_HITS, 1L);
    }

    @Test
    void cancel_discards_late_results_and_skips_pending_units() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeFetcher blocking = new FakeFetcher(u -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return okPage(u);
        });
        List<BatchProgress> events = Collections.synchronizedList(new ArrayList<>());
        BatchHandle h = coordinator(blocking, 1).submit(
                List.of("https://a.example/", "https://b.example/", "https://c.example/"), ALICE, events::add);

        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        h.cancel();
        release.countDown();
        BatchSummary s = h.await(WAIT);

        assertThat(s.state()).isEqualTo(BatchState.CANCELLED);
        assertThat(events).isEmpty();
        assertThat(s.items()).isEmpty();
        assertThat(blocking.callCount()).isEqualTo(1);
    }

    @Test
    void empty_batch_completes_immediately() throws Exception {
        BatchHandle h = coordinator(new FakeFetcher(BatchCoordinatorTest::okPage), 2)
                .submit(List.of(), ALICE, null);
        assertThat(h.isDone()).isTrue();
        BatchSummary s = h.await(Duration.ofMillis(100));
        assertThat(s.state()).isEqualTo(BatchState.COMPLETED);
        assertThat(s.total()).isZero();
    }

    @Test
    void observed_concurrency_never_exceeds_pool_width() throws Exception {
        final int width = 3;
        FakeFetcher slowish = new FakeFetcher(u -> {
            try {
                Thread.sleep(40);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return okPage(u);
        });
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 12; i++) urls.add("https://p" + i + ".example/");

        BatchSummary s = coordinator(slowish, width).submit(urls, ALICE, null).await(WAIT);

        assertThat(s.completed()).isEqualTo(12);
        assertThat(stats.snapshot().maxObservedConcurrency()).isBetween(1, width);
    }

    @Test
    void listener_exceptions_do_not_break_the_batch() throws Exception {
        BatchSummary s = coordinator(new FakeFetcher(BatchCoordinatorTest::okPage), 2)
                .submit(List.of("https://a.example/", "https://b.example/"), ALICE, p -> {
                    throw new IllegalStateException("listener bug");
                })
                .await(WAIT);
        assertThat(s.state()).isEqualTo(BatchState.COMPLETED);
        assertThat(s.completed()).isEqualTo(2);
    }
}
