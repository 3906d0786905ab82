package com.urlsentry.core.support;

import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.persistence.AbstractStorageBackend;
import com.urlsentry.core.persistence.StoreCollection;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** 모든 연산이 PersistenceException을 던지는 저장소. close 여부는 기록한다. */
public final class FailingStorage extends AbstractStorageBackend {
    private volatile boolean closed;

    private static PersistenceException down() {
        return new PersistenceException("storage down (test)");
    }

    @Override public String name() { return "failing"; }
    @Override public Set<String> keys(StoreCollection c) { throw down(); }
    @Override public Optional<Map<String, Object>> readRaw(StoreCollection c, String key) { throw down(); }
    @Override public boolean insertRawIfAbsent(StoreCollection c, String key, Map<String, Object> record) { throw down(); }
    @Override protected void writeRaw(StoreCollection c, String key, Map<String, Object> record) { throw down(); }
    @Override protected boolean deleteRaw(StoreCollection c, String key) { throw down(); }
    @Override protected long count(StoreCollection c) { throw down(); }
    @Override protected void increment(StoreCollection c, String key, String field, long delta) { throw down(); }
    @Override protected long deleteExpired(StoreCollection c, long nowMillis) { throw down(); }
    @Override public void close() { closed = true; }

    public boolean isClosed() { return closed; }
}
