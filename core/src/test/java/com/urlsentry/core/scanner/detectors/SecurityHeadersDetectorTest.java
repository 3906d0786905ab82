package com.urlsentry.core.scanner.detectors;

import com.urlsentry.core.model.FetchOutcome;
import com.urlsentry.core.model.FindingState;
import com.urlsentry.core.model.SecurityFindings;
import com.urlsentry.core.support.Pages;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecurityHeadersDetectorTest {

    private final SecurityHeadersDetector det = new SecurityHeadersDetector();

    @Test
    void hardened_https_response() {
        SecurityFindings s = det.detect(Pages.at("https://a.example/")
                .hardened()
                .header("X-XSS-Protection", "1; mode=block")
                .header("Set-Cookie", "sid=1; Path=/; Secure; HttpOnly", "lang=ko; Secure; HttpOnly")
                .ok());

        assertThat(s.tlsValid()).isEqualTo(FindingState.TRUE);
        assertThat(s.hsts()).isEqualTo(FindingState.TRUE);
        assertThat(s.hstsValue()).isEqualTo("max-age=31536000");
        assertThat(s.csp()).isEqualTo(FindingState.TRUE);
        assertThat(s.frameProtection()).isEqualTo(FindingState.TRUE); // frame-ancestors
        assertThat(s.xssProtection()).isEqualTo(FindingState.TRUE);
        assertThat(s.contentTypeOptions()).isEqualTo(FindingState.TRUE);
        assertThat(s.referrerPolicy()).isEqualTo(FindingState.TRUE);
        assertThat(s.secureCookies()).isEqualTo(FindingState.TRUE);
        assertThat(s.httpOnlyCookies()).isEqualTo(FindingState.TRUE);
        assertThat(s.cookieCount()).isEqualTo(2);
    }

    @Test
    void bare_http_response() {
        SecurityFindings s = det.detect(Pages.at("http://a.example/")
                .header("X-XSS-Protection", "0")
                .header("X-Content-Type-Options", "sniff")
                .header("Set-Cookie", "sid=1; Secure", "track=abc")
                .ok());

        assertThat(s.tlsValid()).isEqualTo(FindingState.FALSE);
        assertThat(s.hsts()).isEqualTo(FindingState.FALSE);
        assertThat(s.csp()).isEqualTo(FindingState.FALSE);
        assertThat(s.frameProtection()).isEqualTo(FindingState.FALSE);
        assertThat(s.xssProtection()).isEqualTo(FindingState.FALSE);
        assertThat(s.contentTypeOptions()).isEqualTo(FindingState.FALSE);
        assertThat(s.secureCookies()).isEqualTo(FindingState.FALSE);
        assertThat(s.httpOnlyCookies()).isEqualTo(FindingState.FALSE);
    }

    @Test
    void no_cookies_means_unknown_cookie_flags() {
        SecurityFindings s = det.detect(Pages.at("https://a.example/").header("X-Frame-Options", "DENY").ok());
        assertThat(s.secureCookies()).isEqualTo(FindingState.UNKNOWN);
        assertThat(s.httpOnlyCookies()).isEqualTo(FindingState.UNKNOWN);
        assertThat(s.cookieCount()).isZero();
        assertThat(s.frameProtection()).isEqualTo(FindingState.TRUE);
    }

    @Test
    void failed_https_fetch_is_not_valid_tls() {
        SecurityFindings s = det.detect(Pages.at("https://a.example/").failed(FetchOutcome.NETWORK_ERROR, "tls handshake failed"));
        assertThat(s.tlsValid()).isEqualTo(FindingState.FALSE);
    }

    @Test
    void cookie_flag_must_be_an_attribute_not_part_of_the_value() {
        assertFalse(SecurityHeadersDetector.hasCookieFlag("secure=1; Path=/", "secure"));
        assertTrue(SecurityHeadersDetector.hasCookieFlag("a=b; path=/; SECURE", "secure"));
        assertFalse(SecurityHeadersDetector.hasCookieFlag("a=b; Path=/httponly", "httponly"));
    }
}
