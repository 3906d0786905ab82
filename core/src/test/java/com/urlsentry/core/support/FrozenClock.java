package com.urlsentry.core.support;

import com.urlsentry.core.util.EngineClock;

import java.time.Duration;
import java.time.Instant;

/** 수동으로 진행시키는 시계 */
public final class FrozenClock implements EngineClock {
    private volatile long now;

    public FrozenClock(Instant start) { this.now = start.toEpochMilli(); }

    public void advance(Duration d) { now += d.toMillis(); }

    @Override public long nowMillis() { return now; }
}
