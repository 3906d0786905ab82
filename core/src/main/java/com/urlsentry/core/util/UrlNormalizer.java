package com.urlsentry.core.util;

import com.urlsentry.core.exception.MalformedUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화(캐시 키) + 호스트 비교 유틸 */
public final class UrlNormalizer {
    private UrlNormalizer(){}

    /**
     * 문자열 입력을 검증 후 정규화.
     * 절대 http/https URL이 아니면 MalformedUrlException.
     */
    public static URI parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedUrlException(raw, "empty url");
        }
        URI u;
        try {
            u = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new MalformedUrlException(raw, "unparseable url: " + e.getMessage(), e);
        }
        requireHttp(u, raw);
        return normalize(u);
    }

    /** 절대 http/https + host 존재 여부 검사 */
    public static void requireHttp(URI u, String raw) {
        if (u == null || !u.isAbsolute()) {
            throw new MalformedUrlException(raw, "not an absolute url");
        }
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new MalformedUrlException(raw, "unsupported scheme: " + scheme);
        }
        if (u.getHost() == null || u.getHost().isBlank()) {
            throw new MalformedUrlException(raw, "missing host");
        }
    }

    /**
     * 정규화 규칙:
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 빈 경로는 "/", 중복 슬래시 축소, 루트가 아니면 끝 슬래시 제거
     * - query는 그대로 유지
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        // raw 조각으로 재조립해 퍼센트 인코딩을 이중 인코딩하지 않는다
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        sb.append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            throw new MalformedUrlException(u.toString(), "normalization failed: " + e.getMessage(), e);
        }
    }

    /** 캐시 키 문자열 */
    public static String key(String raw) {
        return parse(raw).toString();
    }

    /** 비교용 호스트: 소문자 + 선행 "www." 제거 */
    public static String comparableHost(URI u) {
        if (u == null || u.getHost() == null) return "";
        String h = u.getHost().toLowerCase(Locale.ROOT);
        return h.startsWith("www.") ? h.substring(4) : h;
    }

    /** "www." 차이만 있는 경우 같은 도메인으로 본다 */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return comparableHost(a).equals(comparableHost(b));
    }
}
