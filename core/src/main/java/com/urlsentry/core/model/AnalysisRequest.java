package com.urlsentry.core.model;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;

/** 제출된 URL 1건. 정규화된 키와 요청자/시각을 묶는다. 디스패치 후 버려진다. */
public record AnalysisRequest(String normalizedUrl, URI target, RequesterContext requester, Instant requestedAt) {
    public AnalysisRequest {
        Objects.requireNonNull(normalizedUrl, "normalizedUrl");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(requestedAt, "requestedAt");
    }

    /** 정규화가 끝난 URI로 만든다. 캐시 키는 target.toString() */
    public static AnalysisRequest of(URI normalized, RequesterContext requester, Instant requestedAt) {
        Objects.requireNonNull(normalized, "normalized");
        return new AnalysisRequest(normalized.toString(), normalized, requester, requestedAt);
    }
}
