package com.urlsentry.core.model;

import com.urlsentry.core.exception.ErrorCode;

/**
 * 페치 종료 상태.
 * HTTP 4xx/5xx 응답은 OK(상태코드로 구분)이며 TIMEOUT과 섞지 않는다.
 */
public enum FetchOutcome {
    OK(null),
    TIMEOUT(ErrorCode.FETCH_TIMEOUT),
    TOO_MANY_REDIRECTS(ErrorCode.TOO_MANY_REDIRECTS),
    NETWORK_ERROR(ErrorCode.FETCH_ERROR);

    private final ErrorCode errorCode;

    FetchOutcome(ErrorCode errorCode) { this.errorCode = errorCode; }

    /** OK이면 null */
    public ErrorCode errorCode() { return errorCode; }

    public boolean isFailure() { return this != OK; }
}
