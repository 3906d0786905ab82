package com.urlsentry.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/** 카탈로그 기반 위협 판정(피싱/악성코드/핑거프린팅) */
public record ThreatSignal(FindingState state, Confidence confidence, List<String> ruleIds) {

    public ThreatSignal {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(confidence, "confidence");
        ruleIds = (ruleIds == null) ? List.of() : List.copyOf(ruleIds);
    }

    public static ThreatSignal unknown() { return new ThreatSignal(FindingState.UNKNOWN, Confidence.NONE, List.of()); }
    public static ThreatSignal absent()  { return new ThreatSignal(FindingState.FALSE, Confidence.NONE, List.of()); }

    @JsonIgnore
    public boolean isDetected() { return state == FindingState.TRUE; }
}
