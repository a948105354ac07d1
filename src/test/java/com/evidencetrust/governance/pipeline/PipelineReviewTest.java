package com.evidencetrust.governance.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.evidencetrust.Fixtures;
import com.evidencetrust.evidence.EvidenceLog;
import com.evidencetrust.evidence.EvidenceLogSource;
import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Dimension;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.governance.GovernanceConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineReviewTest {

    @Test
    void shouldOpenEachLogOnceAndAverageCompleteness() {
        List<String> opened = new ArrayList<>();
        EvidenceLogSource source = name -> {
            opened.add(name);
            return Fixtures.log(name, "2026-03-01T10:00:00Z", "2026-03-01T09:00:00Z");
        };
        PipelineReview review = new PipelineReview(GovernanceConfig.defaults(), source);

        Map<Dimension, CheckResult> results = review.evaluate(
                Fixtures.completePipeline(List.of("a.jsonl"), Fixtures.probes(false, true, false, true)));

        assertEquals(List.of("a.jsonl"), opened);
        // temporal 85, correlation 50 -> 67.5 rounded
        assertEquals(68.0, results.get(Dimension.COMPLETENESS).score());
        assertTrue(results.get(Dimension.COMPLETENESS).findings().stream()
                .anyMatch(f -> f.category() == FindingCategory.PROBE_EVIDENCE_CORRELATION));
        assertEquals(100.0, results.get(Dimension.EVIDENCE_INTEGRITY).score());
    }

    @Test
    void shouldReportMissingLogInIntegrityOnly() {
        PipelineReview review = new PipelineReview(GovernanceConfig.defaults(), EvidenceLog::missing);

        Map<Dimension, CheckResult> results = review.evaluate(Fixtures.completePipeline(List.of("gone.jsonl"), List.of()));

        assertEquals(70.0, results.get(Dimension.EVIDENCE_INTEGRITY).score());
        assertEquals(100.0, results.get(Dimension.COMPLETENESS).score());
    }
}
