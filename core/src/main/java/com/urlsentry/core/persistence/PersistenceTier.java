package com.urlsentry.core.persistence;

import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EngineConfig;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 저장 계층: 시작 시 한 번 백엔드를 고르고 프로세스가 끝날 때까지 유지한다.
 *  - preferLocal이면 로컬 파일
 *  - 아니면 몽고 ping, 실패하면 로컬 파일로 폴백(WARN 1회)
 *  - 몽고가 선택되고 로컬 디렉터리에 레코드가 있으면 한 번 마이그레이션
 * 이후 실패는 폴백하지 않고 PersistenceException으로 올린다.
 */
public final class PersistenceTier implements StorageBackend {
    private static final Logger LOG = LoggerFactory.getLogger(PersistenceTier.class);
    private static final StructuredLog SLOG = StructuredLog.get(PersistenceTier.class);

    /** 몽고 접속 훅(테스트에서 교체) */
    @FunctionalInterface
    public interface MongoConnector {
        StorageBackend connect(EngineConfig.Storage cfg);
    }

    private final StorageBackend delegate;
    private final boolean fallback;
    private final MigrationReport migration;

    private PersistenceTier(StorageBackend delegate, boolean fallback, MigrationReport migration) {
        this.delegate = delegate;
        this.fallback = fallback;
        this.migration = migration;
    }

    public static PersistenceTier open(EngineConfig.Storage cfg) {
        return open(cfg, MongoStorageBackend::connect);
    }

    public static PersistenceTier open(EngineConfig.Storage cfg, MongoConnector connector) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(connector, "connector");
        Path localDir = cfg.getLocalDir();

        if (cfg.isPreferLocal()) {
            LOG.info("Storage: local files at {} (preferLocal)", localDir.toAbsolutePath());
            SLOG.info("backend-selected", "backend", "file", "reason", "preferLocal");
            return new PersistenceTier(FileStorageBackend.open(localDir), false, null);
        }

        StorageBackend mongo;
        try {
            mongo = connector.connect(cfg);
        } catch (PersistenceException e) {
            LOG.warn("MongoDB unreachable ({}); falling back to local files at {}",
                    e.getMessage(), localDir.toAbsolutePath());
            SLOG.warn("backend-fallback", "backend", "file", "cause", e.getMessage());
            return new PersistenceTier(FileStorageBackend.open(localDir), true, null);
        }

        SLOG.info("backend-selected", "backend", mongo.name());
        MigrationReport report = null;
        try {
            if (FileStorageBackend.hasLocalData(localDir)) {
                try (FileStorageBackend local = FileStorageBackend.open(localDir)) {
                    report = BackendMigrator.migrate(local, mongo);
                }
            }
        } catch (PersistenceException e) {
            mongo.close();
            throw e;
        }
        return new PersistenceTier(mongo, false, report);
    }

    /** 폴백으로 로컬 파일이 선택되었는가 */
    public boolean isFallback() { return fallback; }

    /** 시작 시 수행한 마이그레이션 결과 */
    public Optional<MigrationReport> startupMigration() { return Optional.ofNullable(migration); }

    /** 지정 디렉터리의 로컬 레코드를 현재 백엔드로 복사 (CLI migrate) */
    public MigrationReport migrateFrom(Path dir) {
        try (FileStorageBackend local = FileStorageBackend.open(dir)) {
            return BackendMigrator.migrate(local, delegate);
        }
    }

    public StorageBackend delegate() { return delegate; }

    // ---- 위임 ----
    @Override public String name() { return delegate.name(); }
    @Override public Optional<CacheEntry> readCache(String key) { return delegate.readCache(key); }
    @Override public void writeCache(CacheEntry entry) { delegate.writeCache(entry); }
    @Override public boolean deleteCache(String key) { return delegate.deleteCache(key); }
    @Override public Optional<EntitlementRecord> readEntitlement(String requesterId) { return delegate.readEntitlement(requesterId); }
    @Override public void writeEntitlement(EntitlementRecord record) { delegate.writeEntitlement(record); }
    @Override public boolean deleteEntitlement(String requesterId) { return delegate.deleteEntitlement(requesterId); }
    @Override public boolean isGroupApproved(String groupId) { return delegate.isGroupApproved(groupId); }
    @Override public Optional<EntitlementRecord> readGroupApproval(String groupId) { return delegate.readGroupApproval(groupId); }
    @Override public boolean revokeGroup(String groupId) { return delegate.revokeGroup(groupId); }
    @Override public void incrementMetric(String subject, String counter, long delta) { delegate.incrementMetric(subject, counter, delta); }
    @Override public Map<String, Long> readMetrics(String subject) { return delegate.readMetrics(subject); }
    @Override public StorageStats stats() { return delegate.stats(); }
    @Override public long vacuum(Instant now) { return delegate.vacuum(now); }
    @Override public Set<String> keys(StoreCollection c) { return delegate.keys(c); }
    @Override public Optional<Map<String, Object>> readRaw(StoreCollection c, String key) { return delegate.readRaw(c, key); }
    @Override public boolean insertRawIfAbsent(StoreCollection c, String key, Map<String, Object> record) {
        return delegate.insertRawIfAbsent(c, key, record);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
