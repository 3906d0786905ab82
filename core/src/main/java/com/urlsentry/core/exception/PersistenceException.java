package com.urlsentry.core.exception;

/** 저장소 백엔드 읽기/쓰기 실패. */
public class PersistenceException extends UrlSentryException {

    public PersistenceException(String developerDetails) {
        super(ErrorCode.PERSISTENCE_ERROR, "Storage is temporarily unavailable", developerDetails);
    }

    public PersistenceException(String developerDetails, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, "Storage is temporarily unavailable", developerDetails, cause);
    }
}
