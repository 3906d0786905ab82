package com.urlsentry.core.exception;

import java.util.Objects;

/**
 * 엔진 공통 예외 베이스.
 * getMessage()는 개발자용 상세, getUserMessage()는 사용자에게 보여줄 요약.
 */
public class UrlSentryException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String userMessage;

    public UrlSentryException(ErrorCode errorCode, String userMessage, String developerDetails) {
        super(developerDetails);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.userMessage = userMessage;
    }

    public UrlSentryException(ErrorCode errorCode, String userMessage, String developerDetails, Throwable cause) {
        super(developerDetails, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.userMessage = userMessage;
    }

    public ErrorCode getErrorCode() { return errorCode; }
    public String getUserMessage() { return userMessage; }
}
