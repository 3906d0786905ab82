package com.urlsentry.core.model;

public enum AnalysisStatus {
    /** 정상 페치 후 분류 완료(HTTP 에러 페이지 포함) */
    ANALYZED,
    /** 페치 실패: 모든 판정 UNKNOWN, fetchError 보존 */
    FETCH_FAILED
}
