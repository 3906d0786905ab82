package com.urlsentry.core.scanner.detectors;

import java.util.Locale;

/** 평문(http://)으로 제출되는 폼이 하나라도 있으면 true. action이 비면 페이지 URL로 제출된다. */
public final class InsecureFormDetector {

    public boolean detect(HtmlFacts facts) {
        for (String action : facts.formActions()) {
            if (action.toLowerCase(Locale.ROOT).startsWith("http://")) return true;
        }
        return false;
    }
}
