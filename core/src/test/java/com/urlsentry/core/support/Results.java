package com.urlsentry.core.support;

import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.Confidence;
import com.urlsentry.core.model.GatewayFinding;
import com.urlsentry.core.model.Verdict;

import java.util.List;

public final class Results {
    private Results() {}

    public static AnalysisResult sample(String normalizedUrl) {
        return AnalysisResult.builder()
                .normalizedUrl(normalizedUrl)
                .finalUrl(normalizedUrl)
                .httpStatus(200)
                .gateways(List.of(new GatewayFinding("stripe", Confidence.HIGH, List.of("stripe-js"))))
                .riskScore(10)
                .verdict(Verdict.SAFE)
                .catalogVersion("test-1")
                .analyzedAt(Pages.FETCHED_AT)
                .ttlSeconds(3600)
                .build();
    }
}
