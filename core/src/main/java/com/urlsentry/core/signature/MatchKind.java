package com.urlsentry.core.signature;

/** SUBSTRING은 대소문자 무시 포함 검사, REGEX는 CASE_INSENSITIVE 정규식 find() */
public enum MatchKind {
    SUBSTRING,
    REGEX
}
