package com.urlsentry.core.scanner;

import com.urlsentry.core.model.FindingState;
import com.urlsentry.core.model.SecurityFindings;
import com.urlsentry.core.model.ThreatFindings;
import com.urlsentry.core.model.Verdict;

/**
 * 판정 → 위험 점수(0..100) + 등급.
 * 가중치 합산 후 clamp. 실패한 페치는 점수를 매기지 않는다(UNKNOWN).
 */
public final class RiskScorer {
    private RiskScorer() {}

    static final int W_PHISHING = 40;
    static final int W_MALWARE = 40;
    static final int W_INSECURE_FORM = 15;
    static final int W_SUSPICIOUS_REDIRECT = 10;
    static final int W_PER_CROSS_HOP = 5;
    static final int CAP_REDIRECT = 20;
    static final int W_FINGERPRINTING = 5;
    static final int W_NO_HSTS = 5;       // https 한정
    static final int W_NO_CSP = 5;
    static final int W_NO_FRAME = 3;
    static final int W_WEAK_COOKIES = 5;
    static final int W_MIXED = 5;
    static final int W_NO_TLS = 20;

    public static int score(SecurityFindings s, ThreatFindings t, boolean https) {
        int total = 0;
        if (t.phishing().isDetected()) total += W_PHISHING;
        if (t.malware().isDetected()) total += W_MALWARE;
        if (t.fingerprinting().isDetected()) total += W_FINGERPRINTING;
        if (t.insecureForm().isTrue()) total += W_INSECURE_FORM;
        if (t.suspiciousRedirect().isTrue()) {
            int r = W_SUSPICIOUS_REDIRECT + W_PER_CROSS_HOP * t.suspiciousRedirectCount();
            total += Math.min(CAP_REDIRECT, r);
        }
        if (t.mixedContent().isTrue()) total += W_MIXED;

        if (s.tlsValid() == FindingState.FALSE) total += W_NO_TLS;
        if (https && s.hsts() == FindingState.FALSE) total += W_NO_HSTS;
        if (s.csp() == FindingState.FALSE) total += W_NO_CSP;
        if (s.frameProtection() == FindingState.FALSE) total += W_NO_FRAME;
        if (s.secureCookies() == FindingState.FALSE || s.httpOnlyCookies() == FindingState.FALSE) total += W_WEAK_COOKIES;

        return Math.min(100, Math.max(0, total));
    }

    public static Verdict verdictOf(int score) {
        if (score >= 70) return Verdict.DANGEROUS;
        if (score >= 40) return Verdict.SUSPICIOUS;
        if (score >= 15) return Verdict.LOW_RISK;
        return Verdict.SAFE;
    }
}
