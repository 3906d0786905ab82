package com.urlsentry.core.entitlement;

import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.persistence.StorageBackend;
import com.urlsentry.core.util.EngineClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** 구독/그룹 승인 관리(관리자 CLI에서 사용) */
public final class EntitlementService {
    private static final Logger LOG = LoggerFactory.getLogger(EntitlementService.class);

    private final StorageBackend storage;
    private final EngineClock clock;

    public EntitlementService(StorageBackend storage, EngineClock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 구독 부여/연장. 남은 기간이 있으면 현재 만료 시각부터, 아니면 지금부터 duration 만큼.
     */
    public EntitlementRecord grantSubscription(String requesterId, Duration duration) {
        requireId(requesterId, "requesterId");
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be > 0");
        }
        Instant now = clock.now();
        Instant from = storage.readEntitlement(requesterId)
                .map(EntitlementRecord::expiresAt)
                .filter(exp -> exp.isAfter(now))
                .orElse(now);
        EntitlementRecord rec = EntitlementRecord.subscription(requesterId, from.plus(duration), now);
        storage.writeEntitlement(rec);
        LOG.info("Subscription for {} valid until {}", requesterId, rec.expiresAt());
        return rec;
    }

    public boolean revokeSubscription(String requesterId) {
        boolean removed = storage.deleteEntitlement(requesterId);
        if (removed) LOG.info("Subscription revoked: {}", requesterId);
        return removed;
    }

    public EntitlementRecord approveGroup(String groupId) {
        requireId(groupId, "groupId");
        Optional<EntitlementRecord> existing = storage.readGroupApproval(groupId);
        if (existing.isPresent()) return existing.get(); // 재승인은 최초 승인 시각 유지
        EntitlementRecord rec = EntitlementRecord.groupApproval(groupId, clock.now());
        storage.writeEntitlement(rec);
        LOG.info("Group approved: {}", groupId);
        return rec;
    }

    public boolean revokeGroup(String groupId) {
        boolean removed = storage.revokeGroup(groupId);
        if (removed) LOG.info("Group approval revoked: {}", groupId);
        return removed;
    }

    public Optional<EntitlementRecord> subscriptionOf(String requesterId) {
        return storage.readEntitlement(requesterId);
    }

    private static void requireId(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " must not be blank");
    }
}
