package com.urlsentry.core.service;

/** 배치 상태. PENDING → RUNNING → {COMPLETED, CANCELLED, PARTIALLY_FAILED} */
public enum BatchState {
    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    PARTIALLY_FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == PARTIALLY_FAILED;
    }
}
