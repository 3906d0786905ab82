package com.urlsentry.core.model;

public enum EntitlementKind {
    INDIVIDUAL_SUBSCRIPTION,
    GROUP_APPROVAL
}
