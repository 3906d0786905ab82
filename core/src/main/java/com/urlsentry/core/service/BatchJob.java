package com.urlsentry.core.service;

import com.urlsentry.core.model.RequesterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 배치 1건의 상태/집계. 유닛 결과 반영은 job 모니터 안에서 직렬화되므로
 * 이벤트의 (completed, failed)는 전달 순서대로 단조 증가한다.
 */
public final class BatchJob {
    private static final Logger LOG = LoggerFactory.getLogger(BatchJob.class);

    private final String id;
    private final List<String> urls;
    private final RequesterContext requester;
    private final BatchListener listener;
    private final long startedNanos = System.nanoTime();

    private final AtomicBoolean cancelFlag = new AtomicBoolean(false);
    private final LinkedBlockingQueue<BatchProgress> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<BatchSummary> completion = new CompletableFuture<>();

    // 아래는 this 모니터로 보호
    private BatchState state = BatchState.PENDING;
    private final List<BatchItem> items = new ArrayList<>();
    private int completed;
    private int failed;
    private int settled; // 결과 반영 + 버려진 유닛

    BatchJob(String id, List<String> urls, RequesterContext requester, BatchListener listener) {
        this.id = Objects.requireNonNull(id, "id");
        this.urls = List.copyOf(urls);
        this.requester = Objects.requireNonNull(requester, "requester");
        this.listener = (listener == null) ? BatchListener.NONE : listener;
    }

    public String id() { return id; }
    public List<String> urls() { return urls; }
    public RequesterContext requester() { return requester; }
    public int total() { return urls.size(); }

    AtomicBoolean cancelFlag() { return cancelFlag; }
    LinkedBlockingQueue<BatchProgress> events() { return events; }
    CompletableFuture<BatchSummary> completion() { return completion; }

    public synchronized BatchState state() { return state; }

    public boolean isCancelled() { return cancelFlag.get(); }

    /** PENDING → RUNNING. 빈 배치는 바로 COMPLETED. */
    synchronized void start() {
        if (state != BatchState.PENDING) throw new IllegalStateException("batch " + id + " already " + state);
        state = BatchState.RUNNING;
        if (urls.isEmpty()) finish();
    }

    /** 협조적 취소. 이미 끝난 배치는 영향 없음. */
    public void cancel() {
        if (cancelFlag.compareAndSet(false, true)) {
            LOG.info("Batch {} cancel requested", id);
        }
    }

    /** 유닛 결과 반영. 취소 이후 도착한 결과는 버린다. */
    void record(BatchItem item) {
        BatchProgress event = null;
        synchronized (this) {
            if (state.isTerminal()) return;
            if (!cancelFlag.get()) {
                items.add(item);
                if (item.isSuccess()) completed++; else failed++;
                event = new BatchProgress(id, item, completed, failed, total());
                events.add(event);
                notifyListener(event);
            }
            settled++;
            if (settled >= total()) finish();
        }
    }

    /** 실행되지 않고 버려진 유닛(취소/종료) */
    void abandon() {
        synchronized (this) {
            if (state.isTerminal()) return;
            settled++;
            if (settled >= total()) finish();
        }
    }

    private void notifyListener(BatchProgress event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            LOG.warn("Batch {} listener threw {}", id, e.toString());
        }
    }

    /** this 모니터 안에서만 호출 */
    private void finish() {
        if (cancelFlag.get()) state = BatchState.CANCELLED;
        else if (failed > 0) state = BatchState.PARTIALLY_FAILED;
        else state = BatchState.COMPLETED;
        completion.complete(summaryLocked());
    }

    public synchronized BatchSummary snapshot() {
        return summaryLocked();
    }

    private BatchSummary summaryLocked() {
        long ms = (System.nanoTime() - startedNanos) / 1_000_000;
        return new BatchSummary(id, state, total(), completed, failed, items, ms);
    }
}
