// IClassifier.java
package com.urlsentry.core.api;

import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.signature.SignatureCatalog;

/** 분류기 최소 계약: 페치 결과 + 카탈로그 → 분석 결과 (순수 함수) */
public interface IClassifier {
    AnalysisResult classify(FetchResult fetch, SignatureCatalog catalog);
}
