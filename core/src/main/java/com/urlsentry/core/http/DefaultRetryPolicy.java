package com.urlsentry.core.http;

import com.urlsentry.core.model.FetchOutcome;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * NETWORK_ERROR에서만 재시도. 250ms → 500ms → 1000ms (±10% Jitter)
 * TIMEOUT/TOO_MANY_REDIRECTS는 같은 결과가 반복될 가능성이 높아 재시도하지 않는다.
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(2, 250); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(FetchOutcome outcome, int attempt) {
        if (attempt >= maxAttempts) return false;
        return outcome == FetchOutcome.NETWORK_ERROR;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(20, Math.max(0, attempt - 1)); // 1,2,4...
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
