package com.urlsentry.core.scanner;

import com.urlsentry.core.model.Confidence;
import com.urlsentry.core.model.FindingState;
import com.urlsentry.core.model.SecurityFindings;
import com.urlsentry.core.model.ThreatFindings;
import com.urlsentry.core.model.ThreatSignal;
import com.urlsentry.core.model.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.urlsentry.core.model.FindingState.FALSE;
import static com.urlsentry.core.model.FindingState.TRUE;
import static com.urlsentry.core.model.FindingState.UNKNOWN;
import static org.junit.jupiter.api.Assertions.assertEquals;

class RiskScorerTest {

    private static SecurityFindings secure() {
        return new SecurityFindings(TRUE, TRUE, "max-age=1", TRUE, "default-src 'self'",
                TRUE, TRUE, 1, TRUE, TRUE, TRUE, TRUE);
    }

    private static ThreatFindings clean() {
        return new ThreatFindings(ThreatSignal.absent(), ThreatSignal.absent(), ThreatSignal.absent(),
                FALSE, 0, 0, FALSE, FALSE);
    }

    private static ThreatSignal hit() {
        return new ThreatSignal(FindingState.TRUE, Confidence.HIGH, List.of("r"));
    }

    @Test
    void clean_https_page_scores_zero() {
        assertEquals(0, RiskScorer.score(secure(), clean(), true));
        assertEquals(Verdict.SAFE, RiskScorer.verdictOf(0));
    }

    @Test
    void everything_bad_is_clamped_to_100() {
        SecurityFindings weak = new SecurityFindings(FALSE, FALSE, null, FALSE, null,
                FALSE, FALSE, 2, FALSE, FALSE, FALSE, FALSE);
        ThreatFindings bad = new ThreatFindings(hit(), hit(), hit(), TRUE, 4, 5, TRUE, TRUE);
        assertEquals(100, RiskScorer.score(weak, bad, true));
        assertEquals(Verdict.DANGEROUS, RiskScorer.verdictOf(100));
    }

    @Test
    void missing_hsts_only_counts_on_https() {
        SecurityFindings noHsts = new SecurityFindings(TRUE, FALSE, null, TRUE, "x",
                UNKNOWN, UNKNOWN, 0, TRUE, TRUE, TRUE, TRUE);
        assertEquals(5, RiskScorer.score(noHsts, clean(), true));
        assertEquals(0, RiskScorer.score(noHsts, clean(), false));
    }

    @Test
    void verdict_thresholds() {
        assertEquals(Verdict.SAFE, RiskScorer.verdictOf(14));
        assertEquals(Verdict.LOW_RISK, RiskScorer.verdictOf(15));
        assertEquals(Verdict.SUSPICIOUS, RiskScorer.verdictOf(40));
        assertEquals(Verdict.DANGEROUS, RiskScorer.verdictOf(70));
    }
}
