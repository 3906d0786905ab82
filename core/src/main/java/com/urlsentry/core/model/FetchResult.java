package com.urlsentry.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 한 번의 페치 결과. 파이프라인 호출 하나가 소유하며 요청 간에 공유하지 않는다.
 * - redirectChain: 리다이렉트 응답을 돌려준 URL들(요청 순서). size()가 리다이렉트 횟수.
 * - headers: 키 대소문자 무시, 키 순 정렬
 * - body: maxBodyBytes 까지만 보관(bodyTruncated로 표시)
 */
public final class FetchResult {
    private final URI requestedUrl;
    private final URI finalUrl;
    private final List<URI> redirectChain;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final boolean bodyTruncated;
    private final long elapsedMs;
    private final Instant fetchedAt;
    private final FetchOutcome outcome;
    private final String errorMessage;

    private FetchResult(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null) ? b.requestedUrl : b.finalUrl;
        this.redirectChain = (b.redirectChain == null) ? List.of() : List.copyOf(b.redirectChain);
        this.statusCode = b.statusCode;
        Map<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            for (var e : b.headers.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                h.merge(e.getKey(), List.copyOf(e.getValue()), (a, c) -> {
                    var merged = new java.util.ArrayList<>(a);
                    merged.addAll(c);
                    return List.copyOf(merged);
                });
            }
        }
        this.headers = Collections.unmodifiableMap(h);
        this.body = (b.body == null) ? "" : b.body;
        this.bodyTruncated = b.bodyTruncated;
        this.elapsedMs = b.elapsedMs;
        this.fetchedAt = b.fetchedAt;
        this.outcome = b.outcome;
        this.errorMessage = b.errorMessage;
    }

    public URI getRequestedUrl() { return requestedUrl; }
    public URI getFinalUrl() { return finalUrl; }
    public List<URI> getRedirectChain() { return redirectChain; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public boolean isBodyTruncated() { return bodyTruncated; }
    public long getElapsedMs() { return elapsedMs; }
    public Instant getFetchedAt() { return fetchedAt; }
    public FetchOutcome getOutcome() { return outcome; }
    public String getErrorMessage() { return errorMessage; }

    public boolean isSuccess() { return outcome == FetchOutcome.OK; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        List<String> vs = headers.get(name);
        return (vs == null || vs.isEmpty()) ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        List<String> vs = headers.get(name);
        return vs == null ? List.of() : vs;
    }

    public String getContentType() { return header("Content-Type"); }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    /** 실패 결과 단축 생성 */
    public static FetchResult failure(URI requested, List<URI> chain, FetchOutcome outcome,
                                      String message, long elapsedMs, Instant fetchedAt) {
        return builder()
                .requestedUrl(requested)
                .finalUrl(chain == null || chain.isEmpty() ? requested : chain.get(chain.size() - 1))
                .redirectChain(chain)
                .statusCode(-1)
                .outcome(outcome)
                .errorMessage(message)
                .elapsedMs(elapsedMs)
                .fetchedAt(fetchedAt)
                .build();
    }

    public static final class Builder {
        private URI requestedUrl;
        private URI finalUrl;
        private List<URI> redirectChain;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private boolean bodyTruncated;
        private long elapsedMs;
        private Instant fetchedAt;
        private FetchOutcome outcome = FetchOutcome.OK;
        private String errorMessage;

        public Builder requestedUrl(URI v) { this.requestedUrl = v; return this; }
        public Builder finalUrl(URI v) { this.finalUrl = v; return this; }
        public Builder redirectChain(List<URI> v) { this.redirectChain = v; return this; }
        public Builder statusCode(int v) { this.statusCode = v; return this; }
        public Builder headers(Map<String, List<String>> v) { this.headers = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder bodyTruncated(boolean v) { this.bodyTruncated = v; return this; }
        public Builder elapsedMs(long v) { this.elapsedMs = v; return this; }
        public Builder fetchedAt(Instant v) { this.fetchedAt = v; return this; }
        public Builder outcome(FetchOutcome v) { this.outcome = v; return this; }
        public Builder errorMessage(String v) { this.errorMessage = v; return this; }

        public FetchResult build() {
            Objects.requireNonNull(requestedUrl, "requestedUrl");
            Objects.requireNonNull(outcome, "outcome");
            if (fetchedAt == null) fetchedAt = Instant.EPOCH;
            return new FetchResult(this);
        }
    }
}
