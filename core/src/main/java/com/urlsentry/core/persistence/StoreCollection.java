package com.urlsentry.core.persistence;

/** 저장 단위(몽고 컬렉션 = 로컬 JSON 파일 하나) */
public enum StoreCollection {
    CACHE("cache"),
    ENTITLEMENTS("entitlements"),
    APPROVED_GROUPS("approved_groups"),
    METRICS("metrics");

    private final String collectionName;

    StoreCollection(String collectionName) { this.collectionName = collectionName; }

    public String collectionName() { return collectionName; }

    public String fileName() { return collectionName + ".json"; }
}
