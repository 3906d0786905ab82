package com.urlsentry.core.model;

/** 개별 판정 값. 헤더 부재는 FALSE, 판정 불가(페치 실패 등)는 UNKNOWN. */
public enum FindingState {
    TRUE,
    FALSE,
    UNKNOWN;

    public static FindingState of(boolean b) { return b ? TRUE : FALSE; }

    public boolean isTrue() { return this == TRUE; }
}
