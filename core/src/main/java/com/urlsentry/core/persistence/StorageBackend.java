package com.urlsentry.core.persistence;

import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EntitlementRecord;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 저장소 최소 계약. 몽고/로컬 파일 두 구현이 같은 레코드 모양을 쓴다.
 * 모든 실패는 PersistenceException으로 올라온다.
 * 단일 키 쓰기는 원자적이며 같은 키에 대해서는 마지막 쓰기가 이긴다.
 */
public interface StorageBackend extends AutoCloseable {

    /** "mongo" | "file" */
    String name();

    // ---- cache ----
    Optional<CacheEntry> readCache(String key);
    void writeCache(CacheEntry entry);
    boolean deleteCache(String key);

    // ---- entitlements ----
    /** 개인 구독 레코드 */
    Optional<EntitlementRecord> readEntitlement(String requesterId);
    /** kind에 따라 entitlements / approved_groups 로 나뉘어 저장 */
    void writeEntitlement(EntitlementRecord record);
    boolean deleteEntitlement(String requesterId);
    boolean isGroupApproved(String groupId);
    Optional<EntitlementRecord> readGroupApproval(String groupId);
    boolean revokeGroup(String groupId);

    // ---- metrics ----
    void incrementMetric(String subject, String counter, long delta);
    Map<String, Long> readMetrics(String subject);

    // ---- maintenance ----
    StorageStats stats();
    /** 만료된 캐시/개인 구독을 지우고 삭제 건수 반환 */
    long vacuum(Instant now);

    // ---- raw access (migration) ----
    Set<String> keys(StoreCollection collection);
    Optional<Map<String, Object>> readRaw(StoreCollection collection, String key);
    /** 키가 없을 때만 삽입. 삽입했으면 true */
    boolean insertRawIfAbsent(StoreCollection collection, String key, Map<String, Object> record);

    @Override
    void close();
}
