package com.urlsentry.core.service;

import com.urlsentry.core.exception.ErrorCode;
import com.urlsentry.core.model.AnalysisResult;

import java.util.Objects;

/**
 * 배치 안의 URL 1건 결과.
 * 성공이면 result가, 실패면 errorCode/message가 채워진다.
 * 페치 실패도 result(FETCH_FAILED)를 함께 담는다.
 */
public record BatchItem(int index, String url, AnalysisResult result, ErrorCode errorCode,
                        String message, boolean fromCache) {

    public BatchItem {
        Objects.requireNonNull(url, "url");
        if (result == null && errorCode == null) {
            throw new IllegalArgumentException("item needs a result or an error");
        }
    }

    public static BatchItem success(int index, String url, AnalysisResult result, boolean fromCache) {
        return new BatchItem(index, url, Objects.requireNonNull(result, "result"), null, null, fromCache);
    }

    public static BatchItem failed(int index, String url, AnalysisResult result, ErrorCode code, String message) {
        return new BatchItem(index, url, result, Objects.requireNonNull(code, "code"), message, false);
    }

    public boolean isSuccess() { return errorCode == null; }
}
