package com.urlsentry.core.persistence;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 컬렉션별 레코드 수 + 백엔드 이름 */
public record StorageStats(String backend, Map<StoreCollection, Long> counts) {

    public StorageStats {
        EnumMap<StoreCollection, Long> copy = new EnumMap<>(StoreCollection.class);
        if (counts != null) copy.putAll(counts);
        counts = Collections.unmodifiableMap(copy);
    }

    public long count(StoreCollection c) {
        return counts.getOrDefault(c, 0L);
    }

    public long total() {
        long t = 0;
        for (long v : counts.values()) t += v;
        return t;
    }
}
