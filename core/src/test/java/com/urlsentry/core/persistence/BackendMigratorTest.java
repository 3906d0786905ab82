package com.urlsentry.core.persistence;

import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.support.Results;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BackendMigratorTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void copies_missing_records_and_is_idempotent(@TempDir Path src, @TempDir Path dst) {
        try (FileStorageBackend local = FileStorageBackend.open(src);
             FileStorageBackend target = FileStorageBackend.open(dst)) {
            local.writeCache(new CacheEntry("https://a.example/", Results.sample("https://a.example/"), T0, 60));
            local.writeEntitlement(EntitlementRecord.subscription("alice", T0.plusSeconds(600), T0));
            local.writeEntitlement(EntitlementRecord.groupApproval("team", T0));
            local.incrementMetric("alice", "analyses", 4);

            // target에 이미 있는 구독은 덮어쓰지 않는다
            target.writeEntitlement(EntitlementRecord.subscription("alice", T0.plusSeconds(9_999), T0));

            MigrationReport first = BackendMigrator.migrate(local, target);
            assertThat(first.totalCopied()).isEqualTo(3);
            assertThat(first.totalSkipped()).isEqualTo(1);
            assertThat(target.readEntitlement("alice").orElseThrow().expiresAt()).isEqualTo(T0.plusSeconds(9_999));
            assertThat(target.readCache("https://a.example/")).isPresent();
            assertThat(target.isGroupApproved("team")).isTrue();
            assertThat(target.readMetrics("alice")).containsEntry("analyses", 4L);

            MigrationReport second = BackendMigrator.migrate(local, target);
            assertThat(second.totalCopied()).isZero();
            assertThat(second.totalSkipped()).isEqualTo(4);
            assertThat(target.stats().total()).isEqualTo(4);

            // 원본은 그대로
            assertThat(local.stats().total()).isEqualTo(4);
        }
    }
}
