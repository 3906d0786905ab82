package com.urlsentry.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 엔진 설정 (urlsentry.yml 매핑 대상). 순수 설정 보관용.
 * 로딩/시스템 프로퍼티 오버라이드는 YamlConfigLoader 담당.
 */
public final class EngineConfig {

    /** YAML `storage:` 섹션 */
    public static final class Storage {
        private String mongoUri = "mongodb://localhost:27017";
        private String database = "urlsentry";
        /** true면 네트워크 저장소를 시도하지 않고 로컬 파일 저장소 사용 */
        private boolean preferLocal = false;
        private Path localDir = Path.of("data");
        /** 저장소 연산 타임아웃(페치 타임아웃과 별개) */
        private Duration timeout = Duration.ofSeconds(3);

        public String getMongoUri() { return mongoUri; }
        public Storage setMongoUri(String v) { this.mongoUri = v; return this; }
        public String getDatabase() { return database; }
        public Storage setDatabase(String v) { this.database = v; return this; }
        public boolean isPreferLocal() { return preferLocal; }
        public Storage setPreferLocal(boolean v) { this.preferLocal = v; return this; }
        public Path getLocalDir() { return localDir; }
        public Storage setLocalDir(Path v) { this.localDir = v; return this; }
        public Duration getTimeout() { return timeout; }
        public Storage setTimeout(Duration v) { this.timeout = v; return this; }
    }

    /** YAML `fetch:` 섹션 */
    public static final class Fetch {
        /** 페치 1건 전체 시간 예산(모든 리다이렉트 홉 포함) */
        private Duration timeout = Duration.ofSeconds(15);
        private int maxRedirects = 10;
        private int maxBodyBytes = 1024 * 1024;
        private String userAgent = "UrlSentry/1.0";
        /** 커넥션 슬롯 상한. 0이면 batch.workers 값을 따른다 */
        private int maxConnections = 0;
        private Duration connectionAcquireTimeout = Duration.ofSeconds(5);

        public Duration getTimeout() { return timeout; }
        public Fetch setTimeout(Duration v) { this.timeout = v; return this; }
        public int getMaxRedirects() { return maxRedirects; }
        public Fetch setMaxRedirects(int v) { this.maxRedirects = v; return this; }
        public int getMaxBodyBytes() { return maxBodyBytes; }
        public Fetch setMaxBodyBytes(int v) { this.maxBodyBytes = v; return this; }
        public String getUserAgent() { return userAgent; }
        public Fetch setUserAgent(String v) { this.userAgent = v; return this; }
        public int getMaxConnections() { return maxConnections; }
        public Fetch setMaxConnections(int v) { this.maxConnections = v; return this; }
        public Duration getConnectionAcquireTimeout() { return connectionAcquireTimeout; }
        public Fetch setConnectionAcquireTimeout(Duration v) { this.connectionAcquireTimeout = v; return this; }
    }

    /** YAML `batch:` 섹션 */
    public static final class Batch {
        private int workers = 5;
        /** 네트워크 오류 시 총 시도 횟수(첫 시도 포함) */
        private int retryAttempts = 2;
        private long retryBaseMillis = 250;

        public int getWorkers() { return workers; }
        public Batch setWorkers(int v) { this.workers = v; return this; }
        public int getRetryAttempts() { return retryAttempts; }
        public Batch setRetryAttempts(int v) { this.retryAttempts = v; return this; }
        public long getRetryBaseMillis() { return retryBaseMillis; }
        public Batch setRetryBaseMillis(long v) { this.retryBaseMillis = v; return this; }
    }

    private final Storage storage = new Storage();
    private final Fetch fetch = new Fetch();
    private final Batch batch = new Batch();
    private Duration cacheTtl = Duration.ofHours(1);
    /** 외부 시그니처 카탈로그 경로(없으면 번들 signatures.yml) */
    private Path signaturesPath;

    public Storage storage() { return storage; }
    public Fetch fetch() { return fetch; }
    public Batch batch() { return batch; }

    public Duration getCacheTtl() { return cacheTtl; }
    public EngineConfig setCacheTtl(Duration v) { this.cacheTtl = v; return this; }
    public Path getSignaturesPath() { return signaturesPath; }
    public EngineConfig setSignaturesPath(Path v) { this.signaturesPath = v; return this; }

    /** 실제 커넥션 슬롯 수 */
    public int effectiveMaxConnections() {
        return fetch.maxConnections > 0 ? fetch.maxConnections : Math.max(1, batch.workers);
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(storage.localDir, "storage.localDir");
        if (!storage.preferLocal && (storage.mongoUri == null || storage.mongoUri.isBlank()))
            throw new IllegalArgumentException("storage.mongoUri is required unless storage.preferLocal=true");
        if (storage.database == null || storage.database.isBlank())
            throw new IllegalArgumentException("storage.database must not be blank");
        requirePositive(storage.timeout, "storage.timeout");
        requirePositive(fetch.timeout, "fetch.timeout");
        requirePositive(fetch.connectionAcquireTimeout, "fetch.connectionAcquireTimeout");
        if (fetch.maxRedirects < 0) throw new IllegalArgumentException("fetch.maxRedirects must be >= 0");
        if (fetch.maxBodyBytes < 1) throw new IllegalArgumentException("fetch.maxBodyBytes must be >= 1");
        if (fetch.maxConnections < 0) throw new IllegalArgumentException("fetch.maxConnections must be >= 0");
        if (batch.workers < 1) throw new IllegalArgumentException("batch.workers must be >= 1");
        if (batch.retryAttempts < 1) throw new IllegalArgumentException("batch.retryAttempts must be >= 1");
        if (cacheTtl == null || cacheTtl.isNegative())
            throw new IllegalArgumentException("cache.ttlSeconds must be >= 0");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    public static EngineConfig defaults() { return new EngineConfig(); }
}
