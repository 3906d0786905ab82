package com.urlsentry.core.service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 제출된 배치에 대한 호출자 측 핸들.
 * 진행 이벤트는 리스너(push)와 poll(pull) 두 방식으로 받을 수 있다.
 */
public final class BatchHandle {
    private final BatchJob job;

    BatchHandle(BatchJob job) {
        this.job = job;
    }

    public String id() { return job.id(); }

    public BatchState state() { return job.state(); }

    public int total() { return job.total(); }

    public void cancel() { job.cancel(); }

    public boolean isDone() { return job.completion().isDone(); }

    /** 다음 진행 이벤트. timeout 안에 없으면 empty */
    public Optional<BatchProgress> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(job.events().poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** 종료까지 대기 */
    public BatchSummary await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return job.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // completion은 예외로 끝나지 않는다
            throw new IllegalStateException("batch " + id() + " failed", e.getCause());
        }
    }

    /** 현재까지의 요약(진행 중이면 RUNNING) */
    public BatchSummary snapshot() { return job.snapshot(); }

    public CompletableFuture<BatchSummary> completion() {
        return job.completion().thenApply(s -> s);
    }
}
