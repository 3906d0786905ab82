package com.urlsentry.core.exception;

import com.urlsentry.core.model.DenialReason;

/** analyze/analyzeBatch 진입 시 권한 거부. checkEntitlement는 예외 없이 결정만 반환한다. */
public class EntitlementDeniedException extends UrlSentryException {
    private final DenialReason reason;

    public EntitlementDeniedException(DenialReason reason, String requesterId) {
        super(ErrorCode.ENTITLEMENT_DENIED, reason.userMessage(),
                "requester=" + requesterId + " denied: " + reason);
        this.reason = reason;
    }

    public DenialReason getReason() { return reason; }
}
