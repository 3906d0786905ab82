package com.urlsentry.core.persistence;

import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * source의 레코드 중 target에 없는 키만 복사한다.
 * 이미 있는 키는 건드리지 않으므로 몇 번을 돌려도 결과가 같다.
 */
public final class BackendMigrator {
    private static final Logger LOG = LoggerFactory.getLogger(BackendMigrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(BackendMigrator.class);

    private BackendMigrator() {}

    public static MigrationReport migrate(StorageBackend source, StorageBackend target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");

        Map<StoreCollection, Integer> copied = new EnumMap<>(StoreCollection.class);
        Map<StoreCollection, Integer> skipped = new EnumMap<>(StoreCollection.class);

        for (StoreCollection c : StoreCollection.values()) {
            int ok = 0, skip = 0;
            for (String key : source.keys(c)) {
                var rec = source.readRaw(c, key);
                if (rec.isEmpty()) continue; // 읽는 사이 삭제됨
                if (target.insertRawIfAbsent(c, key, rec.get())) ok++; else skip++;
            }
            copied.put(c, ok);
            skipped.put(c, skip);
        }

        MigrationReport report = new MigrationReport(source.name(), target.name(), copied, skipped);
        LOG.info("Migration {} -> {}: copied={}, skipped={}",
                source.name(), target.name(), report.totalCopied(), report.totalSkipped());
        SLOG.info("migration-done",
                "source", source.name(),
                "target", target.name(),
                "copied", report.totalCopied(),
                "skipped", report.totalSkipped());
        return report;
    }
}
