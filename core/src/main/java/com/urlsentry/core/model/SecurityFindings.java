package com.urlsentry.core.model;

/**
 * 보안 헤더/쿠키/TLS 판정.
 * 쿠키 항목은 Set-Cookie가 하나도 없으면 UNKNOWN.
 */
public record SecurityFindings(
        FindingState tlsValid,
        FindingState hsts,
        String hstsValue,
        FindingState csp,
        String cspValue,
        FindingState secureCookies,
        FindingState httpOnlyCookies,
        int cookieCount,
        FindingState frameProtection,
        FindingState xssProtection,
        FindingState contentTypeOptions,
        FindingState referrerPolicy
) {
    public static SecurityFindings unknown() {
        FindingState u = FindingState.UNKNOWN;
        return new SecurityFindings(u, u, null, u, null, u, u, 0, u, u, u, u);
    }
}
