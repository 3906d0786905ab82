package com.urlsentry.core.signature;

import com.urlsentry.core.exception.ClassificationException;
import com.urlsentry.core.model.Confidence;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * signatures.yml → SignatureCatalog.
 *
 * version: "2024.06"
 * rules:
 *   - id: paypal-sdk
 *     finding: gateway:paypal
 *     target: SCRIPT_SRC          # BODY | SCRIPT_SRC | FINAL_URL | HEADER:Server
 *     match: SUBSTRING            # SUBSTRING | REGEX (기본 SUBSTRING)
 *     pattern: "paypal.com/sdk/js"
 *     confidence: HIGH            # HIGH | MEDIUM | LOW (기본 MEDIUM)
 *
 * 규칙 하나라도 잘못되면 전체 로드가 ClassificationException으로 실패한다.
 */
public final class SignatureCatalogLoader {

    /** 클래스패스 번들 카탈로그 */
    public static final String BUNDLED_RESOURCE = "/signatures.yml";

    private SignatureCatalogLoader() {}

    public static SignatureCatalog loadBundled() {
        try (InputStream in = SignatureCatalogLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new ClassificationException("bundled catalog missing: " + BUNDLED_RESOURCE);
            }
            return load(in, BUNDLED_RESOURCE);
        } catch (IOException e) {
            throw new ClassificationException("cannot read bundled catalog: " + e.getMessage(), e);
        }
    }

    public static SignatureCatalog load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new ClassificationException("catalog not found at: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ClassificationException("cannot read catalog " + path + ": " + e.getMessage(), e);
        }
    }

    public static SignatureCatalog load(InputStream in, String source) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ClassificationException(source + ": invalid YAML: " + e.getMessage(), e);
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new ClassificationException(source + ": catalog root must be a mapping");
        }
        Object version = map.get("version");
        if (version == null || String.valueOf(version).isBlank()) {
            throw new ClassificationException(source + ": 'version' is required");
        }
        Object rawRules = map.get("rules");
        if (!(rawRules instanceof List<?> list)) {
            throw new ClassificationException(source + ": 'rules' must be a list");
        }

        List<SignatureRule> rules = new ArrayList<>(list.size());
        int idx = 0;
        for (Object o : list) {
            idx++;
            if (!(o instanceof Map<?, ?> r)) {
                throw new ClassificationException(source + ": rule #" + idx + " is not a mapping");
            }
            try {
                rules.add(new SignatureRule(
                        str(r, "id"),
                        str(r, "finding"),
                        RuleTarget.parse(str(r, "target")),
                        str(r, "pattern"),
                        enumOr(r, "match", MatchKind.class, MatchKind.SUBSTRING),
                        enumOr(r, "confidence", Confidence.class, Confidence.MEDIUM)));
            } catch (IllegalArgumentException e) {
                throw new ClassificationException(source + ": rule #" + idx + ": " + e.getMessage(), e);
            }
        }
        try {
            return new SignatureCatalog(String.valueOf(version).trim(), rules);
        } catch (IllegalArgumentException e) {
            throw new ClassificationException(source + ": " + e.getMessage(), e);
        }
    }

    private static String str(Map<?, ?> m, String key) {
        Object v = m.get(key);
        return v == null ? null : String.valueOf(v);
    }

    private static <E extends Enum<E>> E enumOr(Map<?, ?> m, String key, Class<E> type, E dflt) {
        Object v = m.get(key);
        if (v == null) return dflt;
        String s = String.valueOf(v).trim().toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + key + ": " + v, e);
        }
    }
}
