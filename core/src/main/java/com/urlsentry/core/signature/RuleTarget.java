package com.urlsentry.core.signature;

import java.util.Locale;
import java.util.Objects;

/**
 * 규칙이 검사할 필드.
 * YAML 표기: BODY | SCRIPT_SRC | FINAL_URL | HEADER:&lt;name&gt;
 */
public record RuleTarget(Kind kind, String headerName) {

    public enum Kind { BODY, SCRIPT_SRC, FINAL_URL, HEADER }

    public static final RuleTarget BODY = new RuleTarget(Kind.BODY, null);
    public static final RuleTarget SCRIPT_SRC = new RuleTarget(Kind.SCRIPT_SRC, null);
    public static final RuleTarget FINAL_URL = new RuleTarget(Kind.FINAL_URL, null);

    public RuleTarget {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.HEADER && (headerName == null || headerName.isBlank())) {
            throw new IllegalArgumentException("HEADER target requires a header name");
        }
        if (kind != Kind.HEADER) headerName = null;
    }

    public static RuleTarget header(String name) {
        return new RuleTarget(Kind.HEADER, name.trim());
    }

    /** 알 수 없는 값이면 IllegalArgumentException */
    public static RuleTarget parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("target is required");
        String s = raw.trim();
        int colon = s.indexOf(':');
        if (colon > 0 && s.substring(0, colon).equalsIgnoreCase("HEADER")) {
            return header(s.substring(colon + 1));
        }
        switch (s.toUpperCase(Locale.ROOT)) {
            case "BODY": return BODY;
            case "SCRIPT_SRC": return SCRIPT_SRC;
            case "FINAL_URL": return FINAL_URL;
            default: throw new IllegalArgumentException("unknown target: " + raw);
        }
    }

    @Override
    public String toString() {
        return kind == Kind.HEADER ? "HEADER:" + headerName : kind.name();
    }
}
