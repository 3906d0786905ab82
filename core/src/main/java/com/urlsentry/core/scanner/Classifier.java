package com.urlsentry.core.scanner;

import com.urlsentry.core.api.IClassifier;
import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.AnalysisStatus;
import com.urlsentry.core.model.Confidence;
import com.urlsentry.core.model.FetchError;
import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.model.FindingState;
import com.urlsentry.core.model.GatewayFinding;
import com.urlsentry.core.model.SecurityFindings;
import com.urlsentry.core.model.ThreatFindings;
import com.urlsentry.core.model.ThreatSignal;
import com.urlsentry.core.model.Verdict;
import com.urlsentry.core.scanner.detectors.HtmlFacts;
import com.urlsentry.core.scanner.detectors.InsecureFormDetector;
import com.urlsentry.core.scanner.detectors.MixedContentDetector;
import com.urlsentry.core.scanner.detectors.RedirectChainDetector;
import com.urlsentry.core.scanner.detectors.SecurityHeadersDetector;
import com.urlsentry.core.signature.SignatureCatalog;
import com.urlsentry.core.signature.SignatureRule;
import com.urlsentry.core.util.UrlNormalizer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 페치 결과 + 카탈로그 → 분석 결과.
 * 순수 함수: 시계/네트워크/저장소를 쓰지 않으며 같은 입력이면 equals 결과를 낸다.
 * TTL은 0으로 두고 캐시에 넣기 직전에 파이프라인이 채운다.
 */
public class Classifier implements IClassifier {

    static final String PHISHING = "threat:phishing";
    static final String MALWARE = "threat:malware";
    static final String FINGERPRINTING = "threat:fingerprinting";

    private final SecurityHeadersDetector headers = new SecurityHeadersDetector();
    private final RedirectChainDetector redirects;
    private final InsecureFormDetector forms = new InsecureFormDetector();
    private final MixedContentDetector mixed = new MixedContentDetector();

    public Classifier() { this(new RedirectChainDetector()); }

    public Classifier(RedirectChainDetector redirects) {
        this.redirects = Objects.requireNonNull(redirects, "redirects");
    }

    @Override
    public AnalysisResult classify(FetchResult fetch, SignatureCatalog catalog) {
        Objects.requireNonNull(fetch, "fetch");
        Objects.requireNonNull(catalog, "catalog");

        AnalysisResult.Builder b = AnalysisResult.builder()
                .normalizedUrl(UrlNormalizer.normalize(fetch.getRequestedUrl()).toString())
                .finalUrl(fetch.getFinalUrl().toString())
                .httpStatus(fetch.getStatusCode())
                .redirectChain(fetch.getRedirectChain().stream().map(URI::toString).toList())
                .catalogVersion(catalog.getVersion())
                .analyzedAt(fetch.getFetchedAt())
                .ttlSeconds(0);

        // 실패한 페치: 모든 판정 UNKNOWN, 점수 없음
        if (!fetch.isSuccess()) {
            return b.status(AnalysisStatus.FETCH_FAILED)
                    .fetchError(new FetchError(fetch.getOutcome(), fetch.getErrorMessage()))
                    .gateways(List.of())
                    .security(SecurityFindings.unknown())
                    .threats(ThreatFindings.unknown())
                    .riskScore(0)
                    .verdict(Verdict.UNKNOWN)
                    .build();
        }

        HtmlFacts facts = HtmlFacts.parse(fetch.getBody(), fetch.getFinalUrl());
        RuleInputs inputs = new RuleInputs(fetch, facts);

        // 1) 게이트웨이: 규칙 평가 → gatewayId 정렬 맵
        Map<String, Acc> gw = new TreeMap<>();
        Map<String, Acc> threats = new TreeMap<>();
        for (SignatureRule r : catalog.getRules()) {
            if (!inputs.matches(r)) continue;
            Map<String, Acc> into = r.isGateway() ? gw : threats;
            String key = r.isGateway() ? r.findingKey() : r.getFindingName();
            into.computeIfAbsent(key, k -> new Acc()).add(r);
        }
        List<GatewayFinding> gateways = new ArrayList<>(gw.size());
        gw.forEach((id, acc) -> gateways.add(new GatewayFinding(id, acc.confidence, List.copyOf(acc.ruleIds))));

        // 2) 보안 헤더
        SecurityFindings security = headers.detect(fetch);

        // 3) 위협
        RedirectChainDetector.Verdict rv = redirects.detect(fetch);
        ThreatFindings threatFindings = new ThreatFindings(
                signal(threats.get(PHISHING)),
                signal(threats.get(MALWARE)),
                signal(threats.get(FINGERPRINTING)),
                FindingState.of(rv.suspicious()),
                rv.crossDomainHops(),
                rv.chainLength(),
                FindingState.of(forms.detect(facts)),
                FindingState.of(mixed.detect(fetch.getFinalUrl(), facts)));

        boolean https = "https".equalsIgnoreCase(fetch.getFinalUrl().getScheme());
        int score = RiskScorer.score(security, threatFindings, https);

        return b.status(AnalysisStatus.ANALYZED)
                .gateways(gateways)
                .security(security)
                .threats(threatFindings)
                .riskScore(score)
                .verdict(RiskScorer.verdictOf(score))
                .build();
    }

    private static ThreatSignal signal(Acc acc) {
        if (acc == null) return ThreatSignal.absent();
        return new ThreatSignal(FindingState.TRUE, acc.confidence, List.copyOf(acc.ruleIds));
    }

    /** 같은 finding으로 모인 매칭: 최고 신뢰도 + 규칙 id(정렬) */
    private static final class Acc {
        Confidence confidence = Confidence.NONE;
        final TreeSet<String> ruleIds = new TreeSet<>();

        void add(SignatureRule r) {
            confidence = confidence.max(r.getConfidence());
            ruleIds.add(r.getId());
        }
    }

    /** 규칙 대상 필드 해석 */
    private record RuleInputs(FetchResult fetch, HtmlFacts facts) {
        boolean matches(SignatureRule r) {
            switch (r.getTarget().kind()) {
                case BODY:
                    return r.matches(fetch.getBody());
                case FINAL_URL:
                    return r.matches(fetch.getFinalUrl().toString());
                case SCRIPT_SRC:
                    for (String src : facts.scriptSrcs()) if (r.matches(src)) return true;
                    return false;
                case HEADER:
                    for (String v : fetch.headers(r.getTarget().headerName())) if (r.matches(v)) return true;
                    return false;
                default:
                    return false;
            }
        }
    }
}
