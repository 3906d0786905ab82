package com.urlsentry.core.persistence;

import com.urlsentry.core.model.AnalysisResult;
import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EngineConfig;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.support.Results;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/** 실제 mongod(컨테이너) 대상. 도커가 없으면 건너뛴다. */
@Testcontainers(disabledWithoutDocker = true)
class MongoStorageBackendTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");
    private static final AtomicInteger DB_SEQ = new AtomicInteger();

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer(DockerImageName.parse("mongo:6.0"));

    private MongoStorageBackend mongo;

    @BeforeEach
    void connect() {
        // 테스트마다 별도 DB
        EngineConfig.Storage cfg = new EngineConfig.Storage()
                .setMongoUri(MONGO.getReplicaSetUrl())
                .setDatabase("urlsentry_test_" + DB_SEQ.incrementAndGet())
                .setTimeout(Duration.ofSeconds(10));
        mongo = MongoStorageBackend.connect(cfg);
    }

    @AfterEach
    void close() {
        mongo.close();
    }

    @Test
    void cache_entry_round_trips_through_documents() {
        AnalysisResult result = Results.sample("https://shop.example/");
        mongo.writeCache(new CacheEntry("https://shop.example/", result, T0, 3600));

        CacheEntry e = mongo.readCache("https://shop.example/").orElseThrow();
        assertThat(e.result()).isEqualTo(result);
        assertThat(e.storedAt()).isEqualTo(T0);
        assertThat(e.ttlSeconds()).isEqualTo(3600);
        assertThat(mongo.readCache("https://other.example/")).isEmpty();
    }

    @Test
    void migration_from_file_copies_once_and_never_overwrites(@TempDir Path dir) {
        try (FileStorageBackend local = FileStorageBackend.open(dir)) {
            local.writeCache(new CacheEntry("https://a.example/", Results.sample("https://a.example/"), T0, 60));
            local.writeEntitlement(EntitlementRecord.subscription("alice", T0.plusSeconds(600), T0));
            local.writeEntitlement(EntitlementRecord.groupApproval("team", T0));
            local.incrementMetric("alice", "analyses", 4);
            mongo.writeEntitlement(EntitlementRecord.subscription("alice", T0.plusSeconds(9_999), T0));

            MigrationReport first = BackendMigrator.migrate(local, mongo);
            assertThat(first.target()).isEqualTo("mongo");
            assertThat(first.totalCopied()).isEqualTo(3);
            assertThat(first.totalSkipped()).isEqualTo(1);

            MigrationReport second = BackendMigrator.migrate(local, mongo);
            assertThat(second.totalCopied()).isZero();
            assertThat(second.totalSkipped()).isEqualTo(4);

            assertThat(mongo.readEntitlement("alice").orElseThrow().expiresAt()).isEqualTo(T0.plusSeconds(9_999));
            assertThat(mongo.readCache("https://a.example/").orElseThrow().result())
                    .isEqualTo(local.readCache("https://a.example/").orElseThrow().result());
            assertThat(mongo.isGroupApproved("team")).isTrue();
            assertThat(mongo.readMetrics("alice")).containsEntry("analyses", 4L);
            assertThat(mongo.stats().total()).isEqualTo(4);
        }
    }

    @Test
    void vacuum_removes_records_expiring_at_or_before_now() {
        mongo.writeCache(new CacheEntry("old", Results.sample("https://old.example/"), T0, 10));
        mongo.writeCache(new CacheEntry("edge", Results.sample("https://edge.example/"), T0, 100));
        mongo.writeCache(new CacheEntry("new", Results.sample("https://new.example/"), T0, 1000));
        mongo.writeEntitlement(EntitlementRecord.subscription("gone", T0.plusSeconds(5), T0));
        mongo.writeEntitlement(EntitlementRecord.groupApproval("forever", T0));

        assertThat(mongo.vacuum(T0.plusSeconds(100))).isEqualTo(3);
        assertThat(mongo.keys(StoreCollection.CACHE)).containsExactly("new");
        assertThat(mongo.readEntitlement("gone")).isEmpty();
        assertThat(mongo.isGroupApproved("forever")).isTrue();
    }

    @Test
    void counters_increment_in_place_and_insert_if_absent_keeps_first() {
        mongo.incrementMetric("bob", "analyses", 2);
        mongo.incrementMetric("bob", "analyses", 3);
        mongo.incrementMetric("bob", "cacheHits", 1);
        assertThat(mongo.readMetrics("bob")).containsEntry("analyses", 5L).containsEntry("cacheHits", 1L);

        assertThat(mongo.insertRawIfAbsent(StoreCollection.METRICS, "k", Map.of("analyses", 1))).isTrue();
        assertThat(mongo.insertRawIfAbsent(StoreCollection.METRICS, "k", Map.of("analyses", 9))).isFalse();
        assertThat(mongo.readMetrics("k")).containsEntry("analyses", 1L);
    }

    @Test
    void group_revoke_and_subscription_delete_report_presence() {
        mongo.writeEntitlement(EntitlementRecord.groupApproval("team-a", T0));
        mongo.writeEntitlement(EntitlementRecord.subscription("alice", T0.plusSeconds(60), T0));

        assertThat(mongo.readEntitlement("team-a")).isEmpty();
        assertThat(mongo.revokeGroup("team-a")).isTrue();
        assertThat(mongo.revokeGroup("team-a")).isFalse();
        assertThat(mongo.deleteEntitlement("alice")).isTrue();
        assertThat(mongo.deleteEntitlement("alice")).isFalse();
    }
}
