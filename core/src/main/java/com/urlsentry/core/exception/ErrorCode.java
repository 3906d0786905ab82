package com.urlsentry.core.exception;

/** 엔진 오류 분류. 프론트엔드가 사용자 메시지를 고를 때 쓰는 안정적인 코드. */
public enum ErrorCode {
    MALFORMED_URL("U1001"),
    FETCH_TIMEOUT("U2001"),
    TOO_MANY_REDIRECTS("U2002"),
    FETCH_ERROR("U2003"),
    CLASSIFICATION_ERROR("U3001"),
    PERSISTENCE_ERROR("U4001"),
    ENTITLEMENT_DENIED("U5001");

    private final String code;

    ErrorCode(String code) { this.code = code; }

    public String code() { return code; }
}
