package com.urlsentry.core.scanner.detectors;

import java.net.URI;

/**
 * Mixed Content detector
 * - HTTPS 문서에서 http:// 서브리소스 참조를 찾는다.
 * - http 문서는 해당 없음(false)
 */
public final class MixedContentDetector {

    public boolean detect(URI pageUrl, HtmlFacts facts) {
        return "https".equalsIgnoreCase(pageUrl.getScheme()) && !facts.httpSubresources().isEmpty();
    }
}
