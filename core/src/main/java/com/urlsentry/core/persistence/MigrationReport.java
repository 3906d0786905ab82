package com.urlsentry.core.persistence;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 마이그레이션 결과: 컬렉션별 복사/건너뜀(대상에 이미 존재) 건수 */
public record MigrationReport(String source, String target,
                              Map<StoreCollection, Integer> copied,
                              Map<StoreCollection, Integer> skipped) {

    public MigrationReport {
        copied = Collections.unmodifiableMap(new EnumMap<>(copied));
        skipped = Collections.unmodifiableMap(new EnumMap<>(skipped));
    }

    public int totalCopied() {
        return copied.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalSkipped() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }
}
