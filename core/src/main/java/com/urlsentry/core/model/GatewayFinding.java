package com.urlsentry.core.model;

import java.util.List;
import java.util.Objects;

/** 결제 게이트웨이 탐지 1건. ruleIds는 매칭된 규칙(정렬). */
public record GatewayFinding(String gateway, Confidence confidence, List<String> ruleIds) {
    public GatewayFinding {
        Objects.requireNonNull(gateway, "gateway");
        Objects.requireNonNull(confidence, "confidence");
        ruleIds = (ruleIds == null) ? List.of() : List.copyOf(ruleIds);
    }
}
