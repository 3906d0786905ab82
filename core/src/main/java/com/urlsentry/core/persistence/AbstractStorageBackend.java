package com.urlsentry.core.persistence;

import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EntitlementKind;
import com.urlsentry.core.model.EntitlementRecord;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 타입 있는 연산을 raw 기본 연산(키 → Map 레코드) 위에 구현.
 * 구현체는 컬렉션 단위 read/write/delete/increment/expire 만 제공하면 된다.
 */
public abstract class AbstractStorageBackend implements StorageBackend {

    // ---- raw 기본 연산 ----
    protected abstract void writeRaw(StoreCollection c, String key, Map<String, Object> record);
    protected abstract boolean deleteRaw(StoreCollection c, String key);
    protected abstract long count(StoreCollection c);
    protected abstract void increment(StoreCollection c, String key, String field, long delta);
    /** expiresAtEpochMs <= nowMillis 인 레코드 삭제 */
    protected abstract long deleteExpired(StoreCollection c, long nowMillis);

    // ---- cache ----
    @Override
    public Optional<CacheEntry> readCache(String key) {
        return readRaw(StoreCollection.CACHE, key).map(RecordCodec::decodeCache);
    }

    @Override
    public void writeCache(CacheEntry entry) {
        Objects.requireNonNull(entry, "entry");
        writeRaw(StoreCollection.CACHE, entry.key(), RecordCodec.encode(entry));
    }

    @Override
    public boolean deleteCache(String key) {
        return deleteRaw(StoreCollection.CACHE, key);
    }

    // ---- entitlements ----
    @Override
    public Optional<EntitlementRecord> readEntitlement(String requesterId) {
        return readRaw(StoreCollection.ENTITLEMENTS, requesterId).map(RecordCodec::decodeEntitlement);
    }

    @Override
    public void writeEntitlement(EntitlementRecord record) {
        Objects.requireNonNull(record, "record");
        StoreCollection c = record.kind() == EntitlementKind.GROUP_APPROVAL
                ? StoreCollection.APPROVED_GROUPS
                : StoreCollection.ENTITLEMENTS;
        writeRaw(c, record.subject(), RecordCodec.encode(record));
    }

    @Override
    public boolean deleteEntitlement(String requesterId) {
        return deleteRaw(StoreCollection.ENTITLEMENTS, requesterId);
    }

    @Override
    public boolean isGroupApproved(String groupId) {
        return groupId != null && readRaw(StoreCollection.APPROVED_GROUPS, groupId).isPresent();
    }

    @Override
    public Optional<EntitlementRecord> readGroupApproval(String groupId) {
        return readRaw(StoreCollection.APPROVED_GROUPS, groupId).map(RecordCodec::decodeEntitlement);
    }

    @Override
    public boolean revokeGroup(String groupId) {
        return deleteRaw(StoreCollection.APPROVED_GROUPS, groupId);
    }

    // ---- metrics ----
    @Override
    public void incrementMetric(String subject, String counter, long delta) {
        increment(StoreCollection.METRICS, subject, counter, delta);
    }

    @Override
    public Map<String, Long> readMetrics(String subject) {
        Map<String, Long> out = new LinkedHashMap<>();
        readRaw(StoreCollection.METRICS, subject).ifPresent(m -> m.forEach((k, v) -> {
            if (v instanceof Number n && !k.startsWith("_")) out.put(k, n.longValue());
        }));
        return out;
    }

    // ---- maintenance ----
    @Override
    public StorageStats stats() {
        Map<StoreCollection, Long> counts = new EnumMap<>(StoreCollection.class);
        for (StoreCollection c : StoreCollection.values()) counts.put(c, count(c));
        return new StorageStats(name(), counts);
    }

    @Override
    public long vacuum(Instant now) {
        long ms = now.toEpochMilli();
        return deleteExpired(StoreCollection.CACHE, ms) + deleteExpired(StoreCollection.ENTITLEMENTS, ms);
    }
}
