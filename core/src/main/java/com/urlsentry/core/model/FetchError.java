package com.urlsentry.core.model;

import java.util.Objects;

/** 실패한 페치의 표시용 요약 (AnalysisResult에 보존) */
public record FetchError(FetchOutcome outcome, String message) {
    public FetchError {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == FetchOutcome.OK) throw new IllegalArgumentException("FetchError requires a failure outcome");
    }
}
