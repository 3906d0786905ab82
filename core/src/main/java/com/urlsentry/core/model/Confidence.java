package com.urlsentry.core.model;

/** 시그니처 매칭 신뢰도. NONE은 매칭 없음. */
public enum Confidence {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public Confidence max(Confidence other) {
        return (other != null && other.ordinal() > ordinal()) ? other : this;
    }
}
