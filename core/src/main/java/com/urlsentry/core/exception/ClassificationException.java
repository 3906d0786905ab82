package com.urlsentry.core.exception;

/** 시그니처 카탈로그 손상(잘못된 규칙/정규식 등). 정상 분류 경로에서는 발생하지 않는다. */
public class ClassificationException extends UrlSentryException {

    public ClassificationException(String developerDetails) {
        super(ErrorCode.CLASSIFICATION_ERROR, "Signature catalog is invalid", developerDetails);
    }

    public ClassificationException(String developerDetails, Throwable cause) {
        super(ErrorCode.CLASSIFICATION_ERROR, "Signature catalog is invalid", developerDetails, cause);
    }
}
