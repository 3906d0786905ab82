package com.urlsentry.core.http;

import com.urlsentry.core.model.FetchOutcome;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책. 페처는 재시도하지 않고 배치 코디네이터가 이 정책을 적용한다. */
public interface RetryPolicy {
    /** attempt는 1부터 시작(현재 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(FetchOutcome outcome, int attempt);
    /** attempt에 해당하는 다음 지연 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: 2면 최대 2번 시도. */
    int maxAttempts();

    /** 재시도 없음 */
    RetryPolicy NONE = new RetryPolicy() {
        @Override public boolean shouldRetry(FetchOutcome outcome, int attempt) { return false; }
        @Override public Duration nextDelay(int attempt) { return Duration.ZERO; }
        @Override public int maxAttempts() { return 1; }
    };
}
