package com.urlsentry.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * URL 1건의 분류 결과. 생성 후 불변이며, 갱신은 새 결과로 캐시 엔트리를 교체하는 방식으로만 한다.
 * analyzedAt은 페치 시각을 그대로 쓰므로 같은 입력이면 같은 결과가 나온다.
 */
@JsonDeserialize(builder = AnalysisResult.Builder.class)
public final class AnalysisResult {
    private final String normalizedUrl;
    private final AnalysisStatus status;
    private final String finalUrl;
    private final int httpStatus;
    private final List<String> redirectChain;
    private final List<GatewayFinding> gateways;
    private final SecurityFindings security;
    private final ThreatFindings threats;
    private final int riskScore;
    private final Verdict verdict;
    private final FetchError fetchError;
    private final String catalogVersion;
    private final Instant analyzedAt;
    private final long ttlSeconds;

    private AnalysisResult(Builder b) {
        this.normalizedUrl = b.normalizedUrl;
        this.status = b.status;
        this.finalUrl = b.finalUrl;
        this.httpStatus = b.httpStatus;
        this.redirectChain = (b.redirectChain == null) ? List.of() : List.copyOf(b.redirectChain);
        this.gateways = (b.gateways == null) ? List.of() : List.copyOf(b.gateways);
        this.security = (b.security == null) ? SecurityFindings.unknown() : b.security;
        this.threats = (b.threats == null) ? ThreatFindings.unknown() : b.threats;
        this.riskScore = b.riskScore;
        this.verdict = (b.verdict == null) ? Verdict.UNKNOWN : b.verdict;
        this.fetchError = b.fetchError;
        this.catalogVersion = b.catalogVersion;
        this.analyzedAt = b.analyzedAt;
        this.ttlSeconds = b.ttlSeconds;
    }

    public String getNormalizedUrl() { return normalizedUrl; }
    public AnalysisStatus getStatus() { return status; }
    public String getFinalUrl() { return finalUrl; }
    public int getHttpStatus() { return httpStatus; }
    public List<String> getRedirectChain() { return redirectChain; }
    public List<GatewayFinding> getGateways() { return gateways; }
    public SecurityFindings getSecurity() { return security; }
    public ThreatFindings getThreats() { return threats; }
    public int getRiskScore() { return riskScore; }
    public Verdict getVerdict() { return verdict; }
    public FetchError getFetchError() { return fetchError; }
    public String getCatalogVersion() { return catalogVersion; }
    public Instant getAnalyzedAt() { return analyzedAt; }
    public long getTtlSeconds() { return ttlSeconds; }

    /** 탐지된 게이트웨이 id 집합(정렬 순서 유지) */
    @JsonIgnore
    public Set<String> gatewayIds() {
        Set<String> out = new LinkedHashSet<>();
        for (GatewayFinding g : gateways) out.add(g.gateway());
        return out;
    }

    @JsonIgnore
    public boolean isFetchFailed() { return status == AnalysisStatus.FETCH_FAILED; }

    /** TTL만 바꾼 새 인스턴스 */
    public AnalysisResult withTtlSeconds(long ttl) {
        return toBuilder().ttlSeconds(ttl).build();
    }

    public Builder toBuilder() {
        return builder()
                .normalizedUrl(normalizedUrl)
                .status(status)
                .finalUrl(finalUrl)
                .httpStatus(httpStatus)
                .redirectChain(redirectChain)
                .gateways(gateways)
                .security(security)
                .threats(threats)
                .riskScore(riskScore)
                .verdict(verdict)
                .fetchError(fetchError)
                .catalogVersion(catalogVersion)
                .analyzedAt(analyzedAt)
                .ttlSeconds(ttlSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisResult r)) return false;
        return httpStatus == r.httpStatus
                && riskScore == r.riskScore
                && ttlSeconds == r.ttlSeconds
                && Objects.equals(normalizedUrl, r.normalizedUrl)
                && status == r.status
                && Objects.equals(finalUrl, r.finalUrl)
                && redirectChain.equals(r.redirectChain)
                && gateways.equals(r.gateways)
                && security.equals(r.security)
                && threats.equals(r.threats)
                && verdict == r.verdict
                && Objects.equals(fetchError, r.fetchError)
                && Objects.equals(catalogVersion, r.catalogVersion)
                && Objects.equals(analyzedAt, r.analyzedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizedUrl, status, finalUrl, httpStatus, redirectChain, gateways,
                security, threats, riskScore, verdict, fetchError, catalogVersion, analyzedAt, ttlSeconds);
    }

    @Override
    public String toString() {
        return "AnalysisResult{" + normalizedUrl + ", status=" + status + ", gateways=" + gatewayIds()
                + ", verdict=" + verdict + ", risk=" + riskScore + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String normalizedUrl;
        private AnalysisStatus status = AnalysisStatus.ANALYZED;
        private String finalUrl;
        private int httpStatus;
        private List<String> redirectChain;
        private List<GatewayFinding> gateways;
        private SecurityFindings security;
        private ThreatFindings threats;
        private int riskScore;
        private Verdict verdict;
        private FetchError fetchError;
        private String catalogVersion;
        private Instant analyzedAt;
        private long ttlSeconds;

        public Builder normalizedUrl(String v) { this.normalizedUrl = v; return this; }
        public Builder status(AnalysisStatus v) { this.status = v; return this; }
        public Builder finalUrl(String v) { this.finalUrl = v; return this; }
        public Builder httpStatus(int v) { this.httpStatus = v; return this; }
        public Builder redirectChain(List<String> v) { this.redirectChain = v; return this; }
        public Builder gateways(List<GatewayFinding> v) { this.gateways = v; return this; }
        public Builder security(SecurityFindings v) { this.security = v; return this; }
        public Builder threats(ThreatFindings v) { this.threats = v; return this; }
        public Builder riskScore(int v) { this.riskScore = v; return this; }
        public Builder verdict(Verdict v) { this.verdict = v; return this; }
        public Builder fetchError(FetchError v) { this.fetchError = v; return this; }
        public Builder catalogVersion(String v) { this.catalogVersion = v; return this; }
        public Builder analyzedAt(Instant v) { this.analyzedAt = v; return this; }
        public Builder ttlSeconds(long v) { this.ttlSeconds = v; return this; }

        public AnalysisResult build() {
            Objects.requireNonNull(normalizedUrl, "normalizedUrl");
            Objects.requireNonNull(status, "status");
            if (status == AnalysisStatus.FETCH_FAILED && fetchError == null) {
                throw new IllegalStateException("FETCH_FAILED result requires fetchError");
            }
            return new AnalysisResult(this);
        }
    }
}
