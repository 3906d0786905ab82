package com.urlsentry.core.entitlement;

import com.urlsentry.core.model.AuthorizationDecision;
import com.urlsentry.core.model.DenialReason;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.model.RequesterContext;
import com.urlsentry.core.persistence.StorageBackend;
import com.urlsentry.core.util.EngineClock;

import java.util.Objects;
import java.util.Optional;

/**
 * 요청자 권한 판정. 부작용 없음(거부 시에도 아무것도 기록하지 않는다).
 *  1) 개인 구독이 now 이후까지 유효하면 허용
 *  2) 그룹 컨텍스트가 있고 승인된 그룹이면 허용
 *  3) 거부 사유: 그룹 컨텍스트가 있으면 GROUP_NOT_APPROVED,
 *     없으면 만료 레코드 유무로 SUBSCRIPTION_EXPIRED / NO_SUBSCRIPTION
 * 저장소 오류는 PersistenceException 그대로 전파.
 */
public final class EntitlementGate {
    private final StorageBackend storage;
    private final EngineClock clock;

    public EntitlementGate(StorageBackend storage, EngineClock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuthorizationDecision authorize(String requesterId, String groupId) {
        return authorize(new RequesterContext(requesterId, groupId));
    }

    public AuthorizationDecision authorize(RequesterContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        Optional<EntitlementRecord> own = storage.readEntitlement(ctx.requesterId());
        if (own.isPresent() && own.get().isActiveAt(clock.now())) {
            return AuthorizationDecision.allowedBy(AuthorizationDecision.Basis.INDIVIDUAL_SUBSCRIPTION);
        }
        if (ctx.groupId() != null) {
            if (storage.isGroupApproved(ctx.groupId())) {
                return AuthorizationDecision.allowedBy(AuthorizationDecision.Basis.GROUP_APPROVAL);
            }
            return AuthorizationDecision.denied(DenialReason.GROUP_NOT_APPROVED);
        }
        return AuthorizationDecision.denied(own.isPresent()
                ? DenialReason.SUBSCRIPTION_EXPIRED
                : DenialReason.NO_SUBSCRIPTION);
    }
}
