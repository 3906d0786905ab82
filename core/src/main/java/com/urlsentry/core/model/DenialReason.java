package com.urlsentry.core.model;

/** 권한 거부 사유 */
public enum DenialReason {
    NO_SUBSCRIPTION("No active subscription"),
    SUBSCRIPTION_EXPIRED("Subscription has expired"),
    GROUP_NOT_APPROVED("This group is not approved");

    private final String userMessage;

    DenialReason(String userMessage) { this.userMessage = userMessage; }

    public String userMessage() { return userMessage; }
}
