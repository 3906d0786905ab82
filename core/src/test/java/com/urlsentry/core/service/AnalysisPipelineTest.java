package com.urlsentry.core.service;

import com.urlsentry.core.cache.AnalysisCache;
import com.urlsentry.core.http.RetryPolicy;
import com.urlsentry.core.model.AnalysisRequest;
import com.urlsentry.core.model.EngineStats;
import com.urlsentry.core.model.FetchOutcome;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.persistence.FileStorageBackend;
import com.urlsentry.core.scanner.Classifier;
import com.urlsentry.core.signature.SignatureCatalogHolder;
import com.urlsentry.core.signature.SignatureCatalogLoader;
import com.urlsentry.core.support.FakeFetcher;
import com.urlsentry.core.support.FrozenClock;
import com.urlsentry.core.support.Pages;
import com.urlsentry.core.util.Sleeper;
import com.urlsentry.core.util.UrlNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisPipelineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @TempDir Path dir;
    private FileStorageBackend storage;

    private AnalysisPipeline pipeline(FakeFetcher fetcher) {
        storage = FileStorageBackend.open(dir);
        AnalysisCache cache = new AnalysisCache(storage, new FrozenClock(NOW), Duration.ofHours(1));
        return new AnalysisPipeline(cache, fetcher, new Classifier(),
                new SignatureCatalogHolder(SignatureCatalogLoader.loadBundled()), new EngineStats(), Sleeper.NONE);
    }

    @AfterEach
    void tearDown() {
        if (storage != null) storage.close();
    }

    @Test
    void request_carries_normalized_key_and_fetch_target() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(u -> Pages.at(u.toString()).hardened().body("<p>ok</p>").ok());
        AnalysisPipeline p = pipeline(fetcher);

        AnalysisRequest req = AnalysisRequest.of(UrlNormalizer.parse("HTTPS://Example.COM:443/Path?q=1#frag"),
                RequesterContext.individual("alice"), NOW);
        assertThat(req.normalizedUrl()).isEqualTo("https://example.com/Path?q=1");
        assertThat(req.target()).isEqualTo(URI.create("https://example.com/Path?q=1"));

        AnalysisPipeline.Outcome first = p.run(req, RetryPolicy.NONE, null);
        assertThat(first.fromCache()).isFalse();
        assertThat(fetcher.calls).containsExactly(req.target());
        assertThat(storage.readCache(req.normalizedUrl())).isPresent();

        // 같은 키의 두 번째 요청은 캐시에서
        AnalysisRequest again = AnalysisRequest.of(UrlNormalizer.parse("https://example.com/Path?q=1"),
                RequesterContext.individual("bob"), NOW.plusSeconds(5));
        AnalysisPipeline.Outcome second = p.run(again, RetryPolicy.NONE, null);
        assertThat(second.fromCache()).isTrue();
        assertThat(second.result()).isEqualTo(first.result());
        assertThat(fetcher.callCount()).isEqualTo(1);
    }

    @Test
    void failed_fetch_is_returned_but_not_cached() throws Exception {
        FakeFetcher fetcher = new FakeFetcher(u -> Pages.at(u.toString()).failed(FetchOutcome.TIMEOUT, "deadline"));
        AnalysisPipeline p = pipeline(fetcher);
        AnalysisRequest req = AnalysisRequest.of(UrlNormalizer.parse("https://slow.example/"),
                RequesterContext.individual("alice"), NOW);

        AnalysisPipeline.Outcome out = p.run(req, RetryPolicy.NONE, null);
        assertThat(out.result().isFetchFailed()).isTrue();
        assertThat(storage.readCache(req.normalizedUrl())).isEmpty();
    }
}
