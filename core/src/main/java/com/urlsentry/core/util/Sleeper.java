package com.urlsentry.core.util;

import java.time.Duration;

/** 재시도 대기 추상화(테스트에서 no-op 주입) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> {};
}
