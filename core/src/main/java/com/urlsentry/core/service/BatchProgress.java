package com.urlsentry.core.service;

/** 유닛 1건 완료 이벤트. completed/failed는 이 이벤트까지 누적 값. */
public record BatchProgress(String batchId, BatchItem item, int completed, int failed, int total) {

    public int finished() { return completed + failed; }

    public double ratio() {
        return total == 0 ? 1.0 : Math.max(0.0, Math.min(1.0, (double) finished() / total));
    }
}
