package com.urlsentry.core.model;

import java.util.Objects;
import java.util.Optional;

/** 요청자 식별 + (있으면) 그룹 컨텍스트 */
public record RequesterContext(String requesterId, String groupId) {

    public RequesterContext {
        Objects.requireNonNull(requesterId, "requesterId");
        if (requesterId.isBlank()) throw new IllegalArgumentException("requesterId must not be blank");
        if (groupId != null && groupId.isBlank()) groupId = null;
    }

    public static RequesterContext individual(String requesterId) {
        return new RequesterContext(requesterId, null);
    }

    public static RequesterContext inGroup(String requesterId, String groupId) {
        return new RequesterContext(requesterId, groupId);
    }

    public Optional<String> group() { return Optional.ofNullable(groupId); }
}
