package com.urlsentry.core.signature;

import com.urlsentry.core.model.Confidence;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 선언형 탐지 규칙 1건.
 * findingName 예: gateway:paypal, threat:phishing
 */
public final class SignatureRule {
    public static final String GATEWAY_PREFIX = "gateway:";
    public static final String THREAT_PREFIX = "threat:";

    private final String id;
    private final String findingName;
    private final RuleTarget target;
    private final String pattern;
    private final MatchKind matchKind;
    private final Confidence confidence;

    // 미리 계산해 둔 매처
    private final String needle;
    private final Pattern regex;

    /** 정규식 오류는 IllegalArgumentException (로더가 카탈로그 오류로 변환) */
    public SignatureRule(String id, String findingName, RuleTarget target, String pattern,
                         MatchKind matchKind, Confidence confidence) {
        this.id = requireText(id, "id");
        this.findingName = requireText(findingName, "findingName").toLowerCase(Locale.ROOT);
        this.target = Objects.requireNonNull(target, "target");
        this.pattern = requireText(pattern, "pattern");
        this.matchKind = Objects.requireNonNull(matchKind, "matchKind");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
        if (confidence == Confidence.NONE) throw new IllegalArgumentException("rule " + id + ": confidence NONE is not allowed");
        if (!this.findingName.startsWith(GATEWAY_PREFIX) && !this.findingName.startsWith(THREAT_PREFIX)) {
            throw new IllegalArgumentException("rule " + id + ": finding must start with gateway: or threat:");
        }
        if (matchKind == MatchKind.REGEX) {
            try {
                this.regex = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("rule " + id + ": bad regex: " + e.getDescription(), e);
            }
            this.needle = null;
        } else {
            this.regex = null;
            this.needle = pattern.toLowerCase(Locale.ROOT);
        }
    }

    private static String requireText(String v, String name) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(name + " is required");
        return v.trim();
    }

    /** 이 규칙이 text에 매칭되는가. null은 불일치. */
    public boolean matches(String text) {
        if (text == null || text.isEmpty()) return false;
        if (regex != null) return regex.matcher(text).find();
        return text.toLowerCase(Locale.ROOT).contains(needle);
    }

    public boolean isGateway() { return findingName.startsWith(GATEWAY_PREFIX); }

    /** "gateway:paypal" → "paypal" */
    public String findingKey() {
        return findingName.substring(findingName.indexOf(':') + 1);
    }

    public String getId() { return id; }
    public String getFindingName() { return findingName; }
    public RuleTarget getTarget() { return target; }
    public String getPattern() { return pattern; }
    public MatchKind getMatchKind() { return matchKind; }
    public Confidence getConfidence() { return confidence; }

    @Override
    public String toString() {
        return id + "[" + findingName + " " + target + " " + matchKind + " " + confidence + "]";
    }
}
