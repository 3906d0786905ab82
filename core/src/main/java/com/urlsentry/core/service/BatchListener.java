package com.urlsentry.core.service;

/** 진행 이벤트 콜백. 워커 스레드에서 호출되며, 던진 예외는 로그만 남기고 무시된다. */
@FunctionalInterface
public interface BatchListener {
    void onProgress(BatchProgress progress);

    BatchListener NONE = p -> {};
}
