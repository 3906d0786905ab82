package com.urlsentry.core.signature;

import com.urlsentry.core.exception.ClassificationException;
import com.urlsentry.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 활성 카탈로그 보관소. 분석 1건은 시작 시점의 카탈로그 하나로 끝까지 진행한다.
 * reload 실패 시 예외를 던지고 이전 카탈로그를 유지한다.
 */
public final class SignatureCatalogHolder {
    private static final Logger LOG = LoggerFactory.getLogger(SignatureCatalogHolder.class);
    private static final StructuredLog SLOG = StructuredLog.get(SignatureCatalogHolder.class);

    private final AtomicReference<SignatureCatalog> active;

    public SignatureCatalogHolder(SignatureCatalog initial) {
        this.active = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    /** path가 null이면 번들 카탈로그 */
    public static SignatureCatalogHolder open(Path path) {
        return new SignatureCatalogHolder(path == null
                ? SignatureCatalogLoader.loadBundled()
                : SignatureCatalogLoader.load(path));
    }

    public SignatureCatalog current() {
        return active.get();
    }

    public SignatureCatalog reload(Path path) {
        SignatureCatalog next;
        try {
            next = (path == null) ? SignatureCatalogLoader.loadBundled() : SignatureCatalogLoader.load(path);
        } catch (ClassificationException e) {
            LOG.warn("Catalog reload failed, keeping version {}: {}", active.get().getVersion(), e.getMessage());
            throw e;
        }
        return swap(next);
    }

    public SignatureCatalog swap(SignatureCatalog next) {
        Objects.requireNonNull(next, "next");
        SignatureCatalog prev = active.getAndSet(next);
        LOG.info("Signature catalog {} -> {} ({} rules)", prev.getVersion(), next.getVersion(), next.size());
        SLOG.info("catalog-reloaded", "from", prev.getVersion(), "to", next.getVersion(), "rules", next.size());
        return next;
    }
}
