package com.urlsentry.core.model;

/**
 * 위협 징후.
 * - suspiciousRedirectCount: 리다이렉트 체인 중 도메인이 바뀐 홉 수
 * - redirectChainLength: 전체 리다이렉트 횟수
 */
public record ThreatFindings(
        ThreatSignal phishing,
        ThreatSignal malware,
        ThreatSignal fingerprinting,
        FindingState suspiciousRedirect,
        int suspiciousRedirectCount,
        int redirectChainLength,
        FindingState insecureForm,
        FindingState mixedContent
) {
    public static ThreatFindings unknown() {
        return new ThreatFindings(ThreatSignal.unknown(), ThreatSignal.unknown(), ThreatSignal.unknown(),
                FindingState.UNKNOWN, 0, 0, FindingState.UNKNOWN, FindingState.UNKNOWN);
    }
}
