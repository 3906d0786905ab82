package com.urlsentry.core.scanner.detectors;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 본문을 jsoup으로 한 번만 파싱해 디텍터들이 공유하는 사실들.
 * - scriptSrcs: 절대 경로로 해석된 script[src]
 * - formActions: 폼별 실제 제출 대상(action이 비면 페이지 URL)
 * - httpSubresources: http:// 로 로드되는 서브리소스(증거 라인)
 */
public final class HtmlFacts {
    private static final int MAX_EVIDENCE = 20; // 과도 수집 방지

    private final List<String> scriptSrcs;
    private final List<String> formActions;
    private final List<String> httpSubresources;

    private HtmlFacts(List<String> scriptSrcs, List<String> formActions, List<String> httpSubresources) {
        this.scriptSrcs = List.copyOf(scriptSrcs);
        this.formActions = List.copyOf(formActions);
        this.httpSubresources = List.copyOf(httpSubresources);
    }

    public static HtmlFacts empty() {
        return new HtmlFacts(List.of(), List.of(), List.of());
    }

    public static HtmlFacts parse(String html, URI pageUrl) {
        if (html == null || html.isBlank()) return empty();
        Document d = Jsoup.parse(html, pageUrl.toString());

        List<String> scripts = new ArrayList<>();
        for (Element e : d.select("script[src]")) {
            String v = e.attr("abs:src");
            scripts.add(v.isEmpty() ? e.attr("src") : v);
        }

        List<String> actions = new ArrayList<>();
        for (Element f : d.select("form")) {
            String raw = f.attr("action").trim();
            if (raw.isEmpty()) {
                actions.add(pageUrl.toString());
            } else {
                String abs = f.attr("abs:action");
                actions.add(abs.isEmpty() ? raw : abs);
            }
        }

        List<String> mixed = new ArrayList<>();
        collectHttp(d, mixed, "script[src]");
        collectHttp(d, mixed, "img[src]");
        collectHttp(d, mixed, "link[href]");        // stylesheet, prefetch 등
        collectHttp(d, mixed, "iframe[src]");
        collectHttp(d, mixed, "audio[src], video[src], source[src], embed[src]");
        collectHttp(d, mixed, "object[data]");

        return new HtmlFacts(scripts, actions, mixed);
    }

    private static void collectHttp(Document d, List<String> out, String css) {
        for (Element e : d.select(css)) {
            if (out.size() >= MAX_EVIDENCE) return;
            String attr = e.hasAttr("src") ? "src" : (e.hasAttr("href") ? "href" : "data");
            String v = e.attr("abs:" + attr);
            if (v.toLowerCase(Locale.ROOT).startsWith("http://")) {
                out.add("<" + e.tagName() + " " + attr + "=\"" + v + "\">");
            }
        }
    }

    public List<String> scriptSrcs() { return scriptSrcs; }
    public List<String> formActions() { return formActions; }
    public List<String> httpSubresources() { return httpSubresources; }
}
