package com.urlsentry.core.support;

import com.urlsentry.core.model.FetchOutcome;
import com.urlsentry.core.model.FetchResult;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 테스트용 페치 결과 빌더 */
public final class Pages {
    public static final Instant FETCHED_AT = Instant.parse("2024-06-01T10:00:00Z");

    private final URI requested;
    private URI finalUrl;
    private List<URI> chain = List.of();
    private int status = 200;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private String body = "";

    private Pages(String url) {
        this.requested = URI.create(url);
        this.finalUrl = requested;
    }

    public static Pages at(String url) { return new Pages(url); }

    public Pages finalUrl(String v) { this.finalUrl = URI.create(v); return this; }
    public Pages chain(String... hops) { this.chain = java.util.Arrays.stream(hops).map(URI::create).toList(); return this; }
    public Pages status(int v) { this.status = v; return this; }
    public Pages header(String name, String... values) { headers.put(name, List.of(values)); return this; }
    public Pages body(String v) { this.body = v; return this; }

    public FetchResult ok() {
        return FetchResult.builder()
                .requestedUrl(requested)
                .finalUrl(finalUrl)
                .redirectChain(chain)
                .statusCode(status)
                .headers(headers)
                .body(body)
                .elapsedMs(12)
                .fetchedAt(FETCHED_AT)
                .outcome(FetchOutcome.OK)
                .build();
    }

    public FetchResult failed(FetchOutcome outcome, String message) {
        return FetchResult.failure(requested, chain, outcome, message, 5, FETCHED_AT);
    }

    /** 보안 헤더를 모두 갖춘 https 응답 */
    public Pages hardened() {
        return header("Strict-Transport-Security", "max-age=31536000")
                .header("Content-Security-Policy", "default-src 'self'; frame-ancestors 'none'")
                .header("X-Content-Type-Options", "nosniff")
                .header("Referrer-Policy", "no-referrer");
    }
}
