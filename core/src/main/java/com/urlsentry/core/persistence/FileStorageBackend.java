package com.urlsentry.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.urlsentry.core.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 로컬 파일 저장소: 컬렉션마다 JSON 파일 하나({key: record}).
 * - 열 때 전부 메모리로 읽고, 쓰기마다 해당 컬렉션 파일을 통째로 다시 쓴다
 * - 쓰기는 컬렉션 단위로 직렬화, 임시 파일 + 원자적 이동으로 반영
 * - 레코드 모양은 몽고 문서와 같다(_id 제외)
 */
public final class FileStorageBackend extends AbstractStorageBackend {
    private static final Logger LOG = LoggerFactory.getLogger(FileStorageBackend.class);
    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> FILE_TYPE = new TypeReference<>() {};

    private final Path dir;
    private final Map<StoreCollection, ConcurrentHashMap<String, Map<String, Object>>> data = new EnumMap<>(StoreCollection.class);
    private final Map<StoreCollection, Object> locks = new EnumMap<>(StoreCollection.class);

    private FileStorageBackend(Path dir) {
        this.dir = dir;
        for (StoreCollection c : StoreCollection.values()) {
            data.put(c, new ConcurrentHashMap<>());
            locks.put(c, new Object());
        }
    }

    /** 디렉터리가 없으면 만든다. 손상된 파일이 있으면 PersistenceException */
    public static FileStorageBackend open(Path dir) {
        Objects.requireNonNull(dir, "dir");
        FileStorageBackend b = new FileStorageBackend(dir);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("cannot create storage dir " + dir + ": " + e.getMessage(), e);
        }
        for (StoreCollection c : StoreCollection.values()) {
            b.data.get(c).putAll(load(dir.resolve(c.fileName())));
        }
        LOG.debug("File storage opened at {}", dir.toAbsolutePath());
        return b;
    }

    /** 디렉터리에 레코드가 하나라도 있는 컬렉션 파일이 있는가 (마이그레이션 판단용) */
    public static boolean hasLocalData(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) return false;
        for (StoreCollection c : StoreCollection.values()) {
            Path f = dir.resolve(c.fileName());
            if (Files.isRegularFile(f) && !load(f).isEmpty()) return true;
        }
        return false;
    }

    private static Map<String, Map<String, Object>> load(Path file) {
        if (!Files.exists(file)) return Map.of();
        try {
            if (Files.size(file) == 0) return Map.of();
            Map<String, Map<String, Object>> m = RecordCodec.mapper().readValue(file.toFile(), FILE_TYPE);
            return m == null ? Map.of() : m;
        } catch (IOException e) {
            throw new PersistenceException("corrupt storage file " + file + ": " + e.getMessage(), e);
        }
    }

    public Path getDir() { return dir; }

    @Override
    public String name() { return "file"; }

    // ---- raw ----
    @Override
    public Set<String> keys(StoreCollection c) {
        return new TreeSet<>(data.get(c).keySet());
    }

    @Override
    public Optional<Map<String, Object>> readRaw(StoreCollection c, String key) {
        if (key == null) return Optional.empty();
        Map<String, Object> m = data.get(c).get(key);
        return m == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(m));
    }

    @Override
    protected void writeRaw(StoreCollection c, String key, Map<String, Object> record) {
        synchronized (locks.get(c)) {
            Map<String, Object> copy = new LinkedHashMap<>(record);
            TreeMap<String, Map<String, Object>> next = snapshot(c);
            next.put(key, copy);
            flush(c, next);
            data.get(c).put(key, copy);
        }
    }

    @Override
    public boolean insertRawIfAbsent(StoreCollection c, String key, Map<String, Object> record) {
        synchronized (locks.get(c)) {
            if (data.get(c).containsKey(key)) return false;
            Map<String, Object> copy = new LinkedHashMap<>(record);
            TreeMap<String, Map<String, Object>> next = snapshot(c);
            next.put(key, copy);
            flush(c, next);
            data.get(c).put(key, copy);
            return true;
        }
    }

    @Override
    protected boolean deleteRaw(StoreCollection c, String key) {
        if (key == null) return false;
        synchronized (locks.get(c)) {
            if (!data.get(c).containsKey(key)) return false;
            TreeMap<String, Map<String, Object>> next = snapshot(c);
            next.remove(key);
            flush(c, next);
            data.get(c).remove(key);
            return true;
        }
    }

    @Override
    protected long count(StoreCollection c) {
        return data.get(c).size();
    }

    @Override
    protected void increment(StoreCollection c, String key, String field, long delta) {
        synchronized (locks.get(c)) {
            Map<String, Object> rec = new LinkedHashMap<>(data.get(c).getOrDefault(key, Map.of()));
            Object cur = rec.get(field);
            long base = (cur instanceof Number n) ? n.longValue() : 0L;
            rec.put(field, base + delta);
            TreeMap<String, Map<String, Object>> next = snapshot(c);
            next.put(key, rec);
            flush(c, next);
            data.get(c).put(key, rec);
        }
    }

    @Override
    protected long deleteExpired(StoreCollection c, long nowMillis) {
        synchronized (locks.get(c)) {
            TreeMap<String, Map<String, Object>> next = snapshot(c);
            Set<String> expired = new TreeSet<>();
            for (Map.Entry<String, Map<String, Object>> e : next.entrySet()) {
                Long exp = RecordCodec.expiresAt(e.getValue());
                if (exp != null && exp <= nowMillis) expired.add(e.getKey());
            }
            if (expired.isEmpty()) return 0;
            next.keySet().removeAll(expired);
            flush(c, next);
            data.get(c).keySet().removeAll(expired);
            return expired.size();
        }
    }

    private TreeMap<String, Map<String, Object>> snapshot(StoreCollection c) {
        return new TreeMap<>(data.get(c));
    }

    /**
     * 컬렉션 락을 잡은 상태에서만 호출.
     * 파일 반영이 끝난 뒤에만 메모리에 적용하므로, 실패하면 메모리와 디스크 모두 이전 상태 그대로다.
     */
    private void flush(StoreCollection c, TreeMap<String, Map<String, Object>> next) {
        Path target = dir.resolve(c.fileName());
        Path tmp = dir.resolve(c.fileName() + ".tmp");
        try {
            RecordCodec.mapper().writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), next);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        // 쓰기마다 flush 하므로 정리할 상태 없음
    }
}
