package com.urlsentry.core.model;

import java.util.Objects;

/**
 * Entitlement Gate 결과.
 * allowed=true 이면 basis가, false 이면 reason이 채워진다.
 */
public record AuthorizationDecision(boolean allowed, Basis basis, DenialReason reason) {

    /** 허용 근거 */
    public enum Basis { INDIVIDUAL_SUBSCRIPTION, GROUP_APPROVAL }

    public static AuthorizationDecision allowedBy(Basis basis) {
        return new AuthorizationDecision(true, Objects.requireNonNull(basis, "basis"), null);
    }

    public static AuthorizationDecision denied(DenialReason reason) {
        return new AuthorizationDecision(false, null, Objects.requireNonNull(reason, "reason"));
    }
}
