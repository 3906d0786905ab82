package com.urlsentry.core.scanner.detectors;

import com.urlsentry.core.model.FetchResult;
import com.urlsentry.core.util.UrlNormalizer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 리다이렉트 체인 판정.
 * 체인 길이가 임계값을 넘거나 도메인이 바뀐 홉이 하나라도 있으면 의심.
 * 도메인 비교는 소문자 + "www." 제거 후 호스트 비교.
 */
public final class RedirectChainDetector {
    public static final int DEFAULT_MAX_CHAIN = 3;

    private final int maxChain;

    public RedirectChainDetector() { this(DEFAULT_MAX_CHAIN); }
    public RedirectChainDetector(int maxChain) { this.maxChain = maxChain; }

    public record Verdict(boolean suspicious, int crossDomainHops, int chainLength) {}

    public Verdict detect(FetchResult resp) {
        List<URI> hops = new ArrayList<>(resp.getRedirectChain());
        if (hops.isEmpty()) hops.add(resp.getRequestedUrl());
        hops.add(resp.getFinalUrl());

        int cross = 0;
        for (int i = 1; i < hops.size(); i++) {
            if (!UrlNormalizer.sameDomain(hops.get(i - 1), hops.get(i))) cross++;
        }
        int len = resp.getRedirectChain().size();
        return new Verdict(len > maxChain || cross > 0, cross, len);
    }
}
