package com.urlsentry.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 구독/그룹 승인 레코드.
 * - INDIVIDUAL_SUBSCRIPTION: expiresAt 필수
 * - GROUP_APPROVAL: expiresAt 없음(명시적 revoke 전까지 유효)
 */
public record EntitlementRecord(String subject, EntitlementKind kind, Instant expiresAt, Instant grantedAt) {

    public EntitlementRecord {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(kind, "kind");
        if (kind == EntitlementKind.INDIVIDUAL_SUBSCRIPTION && expiresAt == null) {
            throw new IllegalArgumentException("individual subscription requires expiresAt");
        }
        if (kind == EntitlementKind.GROUP_APPROVAL && expiresAt != null) {
            throw new IllegalArgumentException("group approval must not expire");
        }
    }

    public static EntitlementRecord subscription(String requesterId, Instant expiresAt, Instant grantedAt) {
        return new EntitlementRecord(requesterId, EntitlementKind.INDIVIDUAL_SUBSCRIPTION, expiresAt, grantedAt);
    }

    public static EntitlementRecord groupApproval(String groupId, Instant grantedAt) {
        return new EntitlementRecord(groupId, EntitlementKind.GROUP_APPROVAL, null, grantedAt);
    }

    /** expiresAt이 now보다 뒤면 유효. 그룹 승인은 항상 유효. */
    public boolean isActiveAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
