package com.urlsentry.core.scanner.detectors;

import com.urlsentry.core.support.Pages;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RedirectChainDetectorTest {

    private final RedirectChainDetector det = new RedirectChainDetector();

    @Test
    void no_redirect_is_not_suspicious() {
        var v = det.detect(Pages.at("https://a.example/").ok());
        assertFalse(v.suspicious());
        assertEquals(0, v.chainLength());
        assertEquals(0, v.crossDomainHops());
    }

    @Test
    void same_site_hops_with_www_are_fine() {
        var v = det.detect(Pages.at("http://example.com/")
                .chain("http://example.com/", "https://example.com/")
                .finalUrl("https://www.example.com/home")
                .ok());
        assertFalse(v.suspicious());
        assertEquals(2, v.chainLength());
        assertEquals(0, v.crossDomainHops());
    }

    @Test
    void any_cross_domain_hop_is_suspicious() {
        var v = det.detect(Pages.at("https://short.example/x")
                .chain("https://short.example/x")
                .finalUrl("https://landing.example/")
                .ok());
        assertTrue(v.suspicious());
        assertEquals(1, v.crossDomainHops());
    }

    @Test
    void long_chain_is_suspicious_even_on_one_domain() {
        var v = det.detect(Pages.at("https://a.example/1")
                .chain("https://a.example/1", "https://a.example/2", "https://a.example/3", "https://a.example/4")
                .finalUrl("https://a.example/5")
                .ok());
        assertTrue(v.suspicious());
        assertEquals(4, v.chainLength());
        assertEquals(0, v.crossDomainHops());
    }
}
