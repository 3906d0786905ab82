package com.urlsentry.core.service;

import java.util.List;

/** 종료된 배치 요약. items는 완료 순서(취소 후 버려진 결과 제외). */
public record BatchSummary(String batchId, BatchState state, int total, int completed, int failed,
                           List<BatchItem> items, long elapsedMs) {

    public BatchSummary {
        items = List.copyOf(items);
    }

    /** 취소 등으로 결과가 없는 유닛 수 */
    public int abandoned() {
        return total - completed - failed;
    }
}
