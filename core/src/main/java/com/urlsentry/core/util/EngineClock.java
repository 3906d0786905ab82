package com.urlsentry.core.util;

import java.time.Instant;

/** 테스트에서 고정/수동 진행 시계를 주입하기 위한 시계 추상화 */
@FunctionalInterface
public interface EngineClock {
    long nowMillis();

    default Instant now() { return Instant.ofEpochMilli(nowMillis()); }

    EngineClock SYSTEM = System::currentTimeMillis;
}
