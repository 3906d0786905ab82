package com.urlsentry.core.util;

import com.urlsentry.core.model.EngineConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * urlsentry.yml을 읽어 EngineConfig로 변환.
 *
 * 예상 YAML 키:
 * storage:
 *   mongoUri: "mongodb://localhost:27017"
 *   database: "urlsentry"
 *   preferLocal: false
 *   localDir: "data"
 *   timeoutMs: 3000
 * cache:
 *   ttlSeconds: 3600
 * fetch:
 *   timeoutMs: 15000
 *   maxRedirects: 10
 *   maxBodyBytes: 1048576
 *   userAgent: "UrlSentry/1.0"
 *   maxConnections: 0
 *   connectionAcquireTimeoutMs: 5000
 * batch:
 *   workers: 5
 *   retryAttempts: 2
 *   retryBaseMs: 250
 * signatures: "path/to/signatures.yml"
 *
 * 파일 값 위에 시스템 프로퍼티가 덮어쓴다: -Dus.storage.preferLocal=true, -Dus.batch.workers=8 ...
 */
public final class YamlConfigLoader {

    public static final String SYS_PREFIX = "us.";

    private YamlConfigLoader() {}

    /** 파일이 없으면 IOException */
    public static EngineConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("urlsentry.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in, System.getProperties());
        }
    }

    /** 파일 없이 기본값 + 시스템 프로퍼티만 */
    public static EngineConfig fromSystemProperties() {
        EngineConfig cfg = EngineConfig.defaults();
        applyOverrides(cfg, System.getProperties());
        cfg.validate();
        return cfg;
    }

    public static EngineConfig load(InputStream in, Properties overrides) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        EngineConfig cfg = EngineConfig.defaults();
        if (root instanceof Map<?, ?> map) {
            apply(cfg, map);
        }
        // 비어있거나 단순 스칼라면 defaults 유지
        if (overrides != null) applyOverrides(cfg, overrides);
        cfg.validate();
        return cfg;
    }

    private static void apply(EngineConfig cfg, Map<?, ?> map) {
        // 1) storage.*
        Map<?, ?> storage = getMap(map, "storage");
        if (storage != null) {
            var s = cfg.storage();
            setString(storage, "mongoUri", s::setMongoUri);
            setString(storage, "database", s::setDatabase);
            setBoolean(storage, "preferLocal", s::setPreferLocal);
            setString(storage, "localDir", v -> s.setLocalDir(Path.of(v)));
            setMillis(storage, "timeoutMs", s::setTimeout);
        }

        // 2) cache.ttlSeconds
        Map<?, ?> cache = getMap(map, "cache");
        if (cache != null) {
            setLong(cache, "ttlSeconds", v -> cfg.setCacheTtl(Duration.ofSeconds(v)));
        }

        // 3) fetch.*
        Map<?, ?> fetch = getMap(map, "fetch");
        if (fetch != null) {
            var f = cfg.fetch();
            setMillis(fetch, "timeoutMs", f::setTimeout);
            setInt(fetch, "maxRedirects", f::setMaxRedirects);
            setInt(fetch, "maxBodyBytes", f::setMaxBodyBytes);
            setString(fetch, "userAgent", f::setUserAgent);
            setInt(fetch, "maxConnections", f::setMaxConnections);
            setMillis(fetch, "connectionAcquireTimeoutMs", f::setConnectionAcquireTimeout);
        }

        // 4) batch.*
        Map<?, ?> batch = getMap(map, "batch");
        if (batch != null) {
            var b = cfg.batch();
            setInt(batch, "workers", b::setWorkers);
            setInt(batch, "retryAttempts", b::setRetryAttempts);
            setLong(batch, "retryBaseMs", b::setRetryBaseMillis);
        }

        // 5) signatures (빈 문자열이면 번들 카탈로그)
        setString(map, "signatures", v -> cfg.setSignaturesPath(v.isBlank() ? null : Path.of(v)));
    }

    /** us.<section>.<key> 형태의 시스템 프로퍼티를 YAML과 같은 구조로 바꿔 한 번 더 적용 */
    static void applyOverrides(EngineConfig cfg, Properties props) {
        Map<String, Object> root = new java.util.LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (!name.startsWith(SYS_PREFIX)) continue;
            String path = name.substring(SYS_PREFIX.length());
            if (path.startsWith("log.")) continue; // 로깅 설정은 LogSetup 담당
            String value = props.getProperty(name);
            int dot = path.indexOf('.');
            if (dot < 0) {
                root.put(path, value);
            } else {
                @SuppressWarnings("unchecked")
                Map<String, Object> section = (Map<String, Object>) root.computeIfAbsent(
                        path.substring(0, dot), k -> new java.util.LinkedHashMap<String, Object>());
                section.put(path.substring(dot + 1), value);
            }
        }
        if (!root.isEmpty()) apply(cfg, root);
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseLong(key, v));
    }

    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseLong(key, v);
        setter.accept(Duration.ofMillis(ms)); // 0 이하 값은 validate()에서 거부
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static long parseLong(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
