package com.urlsentry.core.model;

public enum Verdict {
    SAFE,
    LOW_RISK,
    SUSPICIOUS,
    DANGEROUS,
    UNKNOWN
}
