package com.urlsentry.core.scanner.detectors;

import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.model.FindingState;
import com.urlsentry.core.model.SecurityFindings;

import java.util.List;
import java.util.Locale;

/** 패시브: 응답 헤더/쿠키/TLS 품질 판정 */
public final class SecurityHeadersDetector {

    public SecurityFindings detect(FetchResult resp) {
        String hsts = header(resp, "Strict-Transport-Security");
        String csp  = header(resp, "Content-Security-Policy");
        String xfo  = header(resp, "X-Frame-Options");
        String xxp  = header(resp, "X-XSS-Protection");
        String xcto = header(resp, "X-Content-Type-Options");
        String refp = header(resp, "Referrer-Policy");
        List<String> setCookies = resp.headers("Set-Cookie");

        // TLS: https 최종 URL까지 핸드셰이크가 성공했으면 유효. http는 TLS 없음.
        boolean https = "https".equalsIgnoreCase(resp.getFinalUrl().getScheme());
        FindingState tls = FindingState.of(https && resp.isSuccess());

        // 프레이밍 방어: XFO 또는 CSP frame-ancestors
        boolean frame = xfo != null
                || (csp != null && csp.toLowerCase(Locale.ROOT).contains("frame-ancestors"));

        // X-XSS-Protection: 존재하고 "0"(비활성)이 아니어야 함
        boolean xss = xxp != null && !xxp.startsWith("0");

        // 쿠키: 하나도 없으면 판정 불가
        FindingState secure = FindingState.UNKNOWN;
        FindingState httpOnly = FindingState.UNKNOWN;
        if (!setCookies.isEmpty()) {
            boolean allSecure = true;
            boolean allHttpOnly = true;
            for (String sc : setCookies) {
                allSecure &= hasCookieFlag(sc, "secure");
                allHttpOnly &= hasCookieFlag(sc, "httponly");
            }
            secure = FindingState.of(allSecure);
            httpOnly = FindingState.of(allHttpOnly);
        }

        return new SecurityFindings(
                tls,
                FindingState.of(hsts != null), hsts,
                FindingState.of(csp != null), csp,
                secure, httpOnly, setCookies.size(),
                FindingState.of(frame),
                FindingState.of(xss),
                FindingState.of(xcto != null && xcto.equalsIgnoreCase("nosniff")),
                FindingState.of(refp != null));
    }

    /* ----------------- 헬퍼 ----------------- */

    /** 쿠키 속성 토큰 비교(값 안에 "secure" 문자열이 있어도 속성으로 보지 않음) */
    static boolean hasCookieFlag(String setCookie, String flag) {
        String[] parts = setCookie.split(";");
        for (int i = 1; i < parts.length; i++) { // 0번은 name=value
            String attr = parts[i].trim();
            int eq = attr.indexOf('=');
            String name = (eq < 0 ? attr : attr.substring(0, eq)).trim();
            if (name.equalsIgnoreCase(flag)) return true;
        }
        return false;
    }

    /** 공백 값은 부재로 취급 */
    private static String header(FetchResult r, String name) {
        String v = r.header(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
