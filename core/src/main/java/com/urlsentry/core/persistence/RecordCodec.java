package com.urlsentry.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.model.CacheEntry;
import com.urlsentry.core.model.EntitlementRecord;
import com.urlsentry.core.util.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 도메인 객체 ↔ 저장 레코드(Map) 변환.
 * 몽고 문서와 로컬 JSON이 같은 모양을 쓰도록 한 곳에서만 변환한다.
 * 만료가 있는 레코드에는 조회/정리용 expiresAtEpochMs 필드를 덧붙인다.
 */
final class RecordCodec {
    static final String EXPIRES_FIELD = "expiresAtEpochMs";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final ObjectMapper MAPPER = Json.newMapper();

    private RecordCodec() {}

    static Map<String, Object> encode(CacheEntry e) {
        Map<String, Object> m = toMap(e);
        m.put(EXPIRES_FIELD, e.expiresAtEpochMs());
        return m;
    }

    static CacheEntry decodeCache(Map<String, Object> m) {
        return fromMap(m, CacheEntry.class);
    }

    static Map<String, Object> encode(EntitlementRecord r) {
        Map<String, Object> m = toMap(r);
        if (r.expiresAt() != null) m.put(EXPIRES_FIELD, r.expiresAt().toEpochMilli());
        return m;
    }

    static EntitlementRecord decodeEntitlement(Map<String, Object> m) {
        return fromMap(m, EntitlementRecord.class);
    }

    static Map<String, Object> toMap(Object value) {
        try {
            return MAPPER.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("cannot encode " + value.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    static <T> T fromMap(Map<String, Object> m, Class<T> type) {
        Map<String, Object> copy = new LinkedHashMap<>(m);
        copy.remove("_id");
        try {
            return MAPPER.convertValue(copy, type);
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("corrupt " + type.getSimpleName() + " record: " + e.getMessage(), e);
        }
    }

    /** 만료 필드(숫자) 읽기. 없으면 null */
    static Long expiresAt(Map<String, Object> m) {
        Object v = m.get(EXPIRES_FIELD);
        return (v instanceof Number n) ? n.longValue() : null;
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
