package com.urlsentry.core.http;

import com.urlsentry.core.api.IFetcher;
import com.urlsentry.core.model.EngineConfig;
import com.urlsentry.core.model.FetchOutcome;
import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.util.EngineClock;
import com.urlsentry.core.util.StructuredLog;
import com.urlsentry.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * URL 1건을 가져온다.
 *  - 공유 HttpClient(커넥션 풀) + 자동 리다이렉트 끔: 3xx는 직접 따라가며 홉을 기록
 *  - 페치 1건의 전체 시간 예산(모든 홉 포함)을 넘으면 TIMEOUT
 *  - 동시 아웃바운드 요청은 커넥션 슬롯 세마포어로 제한
 *  - 본문은 maxBodyBytes까지만 읽는다
 *  - 재시도하지 않는다(배치 코디네이터의 RetryPolicy 담당)
 */
public class Fetcher implements IFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(Fetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(Fetcher.class);

    private static final Set<Integer> REDIRECTS = Set.of(301, 302, 303, 307, 308);

    /** 테스트/모킹용 송신 훅. 요청의 timeout()에 남은 예산이 실려 온다. */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws Exception;
    }

    private final EngineConfig.Fetch cfg;
    private final EngineClock clock;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final Semaphore slots;
    private final ScheduledExecutorService watchdog;

    public Fetcher(EngineConfig config) {
        this(config, EngineClock.SYSTEM, null);
    }

    /** 테스트용 생성자(송신 훅/시계 주입). sender가 null이면 HttpClient 사용 */
    public Fetcher(EngineConfig config, EngineClock clock, HttpSender testSender) {
        Objects.requireNonNull(config, "config");
        this.cfg = config.fetch();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sender = testSender;
        this.client = (testSender != null) ? null : HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(cfg.getTimeout())
                .build();
        this.slots = new Semaphore(config.effectiveMaxConnections(), true);
        this.watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fetch-watchdog");
            t.setDaemon(true);
            return t;
        });
    }

    /** 현재 비어 있는 커넥션 슬롯 수 */
    public int availableSlots() {
        return slots.availablePermits();
    }

    @Override
    public FetchResult fetch(URI url) {
        UrlNormalizer.requireHttp(url, String.valueOf(url)); // 잘못된 입력은 I/O 전에 예외
        Instant fetchedAt = clock.now();
        long start = System.nanoTime();

        boolean acquired;
        try {
            acquired = slots.tryAcquire(cfg.getConnectionAcquireTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(url, List.of(), FetchOutcome.NETWORK_ERROR, "interrupted", 0, fetchedAt);
        }
        if (!acquired) {
            long ms = elapsedMs(start);
            LOG.debug("No connection slot within {} for {}", cfg.getConnectionAcquireTimeout(), url);
            return FetchResult.failure(url, List.of(), FetchOutcome.TIMEOUT,
                    "no connection slot available within " + cfg.getConnectionAcquireTimeout().toMillis() + "ms",
                    ms, fetchedAt);
        }
        try {
            FetchResult r = doFetch(url, fetchedAt);
            SLOG.debug("fetch-done",
                    "url", String.valueOf(url),
                    "outcome", r.getOutcome(),
                    "status", r.getStatusCode(),
                    "hops", r.getRedirectChain().size(),
                    "ms", r.getElapsedMs());
            return r;
        } finally {
            slots.release();
        }
    }

    private FetchResult doFetch(URI url, Instant fetchedAt) {
        final long start = System.nanoTime();
        final long deadline = start + cfg.getTimeout().toNanos();
        final List<URI> chain = new ArrayList<>();
        URI current = url;

        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return FetchResult.failure(url, chain, FetchOutcome.TIMEOUT,
                        "fetch exceeded " + cfg.getTimeout().toMillis() + "ms", elapsedMs(start), fetchedAt);
            }

            HttpResponse<InputStream> resp;
            try {
                resp = send(request(current, Duration.ofNanos(remaining)), remaining);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(url, chain, FetchOutcome.NETWORK_ERROR, "interrupted", elapsedMs(start), fetchedAt);
            } catch (Exception e) {
                return failureOf(url, chain, e, start, fetchedAt);
            }

            int status = resp.statusCode();
            if (REDIRECTS.contains(status)) {
                String location = resp.headers().firstValue("Location").orElse(null);
                closeQuietly(resp.body());
                if (location != null && !location.isBlank()) {
                    chain.add(current);
                    if (chain.size() > cfg.getMaxRedirects()) {
                        return FetchResult.failure(url, chain, FetchOutcome.TOO_MANY_REDIRECTS,
                                "more than " + cfg.getMaxRedirects() + " redirects", elapsedMs(start), fetchedAt);
                    }
                    URI next;
                    try {
                        next = current.resolve(location.trim());
                    } catch (IllegalArgumentException e) {
                        return FetchResult.failure(url, chain, FetchOutcome.NETWORK_ERROR,
                                "invalid redirect location: " + location, elapsedMs(start), fetchedAt);
                    }
                    String scheme = next.getScheme() == null ? "" : next.getScheme().toLowerCase(Locale.ROOT);
                    if (!scheme.equals("http") && !scheme.equals("https")) {
                        return FetchResult.failure(url, chain, FetchOutcome.NETWORK_ERROR,
                                "redirect to unsupported scheme: " + next, elapsedMs(start), fetchedAt);
                    }
                    current = next;
                    continue;
                }
                // Location 없는 3xx는 최종 응답으로 취급
            }

            // 최종 응답: 본문을 남은 예산 안에서 읽는다
            BodyRead body;
            try {
                body = readBody(resp, deadline);
            } catch (IOException e) {
                if (System.nanoTime() >= deadline) {
                    return FetchResult.failure(url, chain, FetchOutcome.TIMEOUT,
                            "body read exceeded " + cfg.getTimeout().toMillis() + "ms", elapsedMs(start), fetchedAt);
                }
                return failureOf(url, chain, e, start, fetchedAt);
            }

            return FetchResult.builder()
                    .requestedUrl(url)
                    .finalUrl(current)
                    .redirectChain(chain)
                    .statusCode(status)
                    .headers(resp.headers().map())
                    .body(body.text)
                    .bodyTruncated(body.truncated)
                    .elapsedMs(elapsedMs(start))
                    .fetchedAt(fetchedAt)
                    .outcome(FetchOutcome.OK)
                    .build();
        }
    }

    private HttpRequest request(URI url, Duration remaining) {
        return HttpRequest.newBuilder(url)
                .timeout(remaining)
                .header("User-Agent", cfg.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                .GET()
                .build();
    }

    /** sender가 있으면 sender로, 아니면 HttpClient 비동기 전송 + 남은 예산만큼 대기 */
    private HttpResponse<InputStream> send(HttpRequest req, long remainingNanos) throws Exception {
        if (sender != null) return sender.send(req);
        CompletableFuture<HttpResponse<InputStream>> f =
                client.sendAsync(req, HttpResponse.BodyHandlers.ofInputStream());
        try {
            return f.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            throw te;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw ee;
        }
    }

    private record BodyRead(String text, boolean truncated) {}

    /** 예산이 끝나면 워치독이 스트림을 닫아 블로킹 read를 깨운다 */
    private BodyRead readBody(HttpResponse<InputStream> resp, long deadline) throws IOException {
        InputStream in = resp.body();
        if (in == null) return new BodyRead("", false);
        long delay = Math.max(0, deadline - System.nanoTime());
        ScheduledFuture<?> guard = watchdog.schedule(() -> closeQuietly(in), delay, TimeUnit.NANOSECONDS);
        try (in) {
            int cap = cfg.getMaxBodyBytes();
            ByteArrayOutputStream buf = new ByteArrayOutputStream(Math.min(cap, 16 * 1024));
            byte[] chunk = new byte[8192];
            boolean truncated = false;
            int n;
            while ((n = in.read(chunk)) != -1) {
                int room = cap - buf.size();
                if (n > room) {
                    buf.write(chunk, 0, room);
                    truncated = true;
                    break;
                }
                buf.write(chunk, 0, n);
            }
            Charset cs = charsetOf(resp.headers().firstValue("Content-Type").orElse(null));
            return new BodyRead(buf.toString(cs), truncated);
        } finally {
            guard.cancel(false);
        }
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    /** 전송 예외 → 실패 결과. 타임아웃만 TIMEOUT, 나머지(DNS/TLS/거부/기타 I/O)는 NETWORK_ERROR */
    private FetchResult failureOf(URI url, List<URI> chain, Exception e, long start, Instant fetchedAt) {
        FetchOutcome outcome;
        String msg;
        if (e instanceof TimeoutException || e instanceof HttpTimeoutException || e instanceof CancellationException) {
            outcome = FetchOutcome.TIMEOUT;
            msg = "fetch exceeded " + cfg.getTimeout().toMillis() + "ms";
        } else if (e instanceof UnknownHostException) {
            outcome = FetchOutcome.NETWORK_ERROR;
            msg = "dns resolution failed: " + e.getMessage();
        } else if (e instanceof SSLException) {
            outcome = FetchOutcome.NETWORK_ERROR;
            msg = "tls handshake failed: " + e.getMessage();
        } else if (e instanceof ConnectException) {
            outcome = FetchOutcome.NETWORK_ERROR;
            msg = "connection refused: " + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } else {
            outcome = FetchOutcome.NETWORK_ERROR;
            msg = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
        }
        LOG.debug("Fetch failed {} -> {} ({})", url, outcome, msg);
        return FetchResult.failure(url, chain, outcome, msg, elapsedMs(start), fetchedAt);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            LOG.trace("close failed: {}", e.toString());
        }
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
    }
}
