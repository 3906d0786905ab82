package com.urlsentry.core.signature;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** 버전이 붙은 불변 규칙 목록. 생성 후 변경하지 않고, 교체는 SignatureCatalogHolder로 한다. */
public final class SignatureCatalog {
    private final String version;
    private final List<SignatureRule> rules;

    public SignatureCatalog(String version, List<SignatureRule> rules) {
        if (version == null || version.isBlank()) throw new IllegalArgumentException("version is required");
        this.version = version;
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        Set<String> ids = new HashSet<>();
        for (SignatureRule r : this.rules) {
            if (!ids.add(r.getId())) throw new IllegalArgumentException("duplicate rule id: " + r.getId());
        }
    }

    public String getVersion() { return version; }
    public List<SignatureRule> getRules() { return rules; }
    public int size() { return rules.size(); }

    @Override
    public String toString() {
        return "SignatureCatalog{version=" + version + ", rules=" + rules.size() + "}";
    }
}
