package com.evidencetrust.governance.document;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Severity;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentCompletenessScorerTest {
    private final DocumentCompletenessScorer scorer = new DocumentCompletenessScorer();

    @Test
    void shouldRewardCoverageDisclosureAndScope() {
        DocumentBundle bundle = new DocumentBundle(
                DocumentSource.SOC2,
                List.of(Control.of("A", ControlStatus.EFFECTIVE, "evidence")),
                metadata("Production AWS environment and corporate IT"),
                context(List.of("Physical security carved out")));

        // 60 + 25 + 10 + 5
        assertEquals(100.0, scorer.score(bundle).score());
    }

    @Test
    void shouldScalePartialCoverage() {
        DocumentBundle bundle = new DocumentBundle(
                DocumentSource.SOC2,
                List.of(
                        Control.of("A", ControlStatus.EFFECTIVE, "evidence"),
                        Control.of("B", ControlStatus.EFFECTIVE, "evidence"),
                        Control.of("C", ControlStatus.EFFECTIVE, ""),
                        Control.of("D", ControlStatus.EFFECTIVE, "")),
                metadata("short"),
                null);

        // 60 + round(0.5 * 20)
        assertEquals(70.0, scorer.score(bundle).score());
    }

    @Test
    void shouldPenalizeExcessiveGaps() {
        DocumentBundle bundle = new DocumentBundle(
                DocumentSource.SOC2,
                List.of(Control.of("A", ControlStatus.EFFECTIVE, "evidence")),
                null,
                context(List.of("g1", "g2", "g3", "g4", "g5", "g6")));

        CheckResult result = scorer.score(bundle);

        // 60 + 25 - 3 * 3
        assertEquals(76.0, result.score());
        assertEquals(1, result.count(Severity.INFO));
    }

    private static DocumentBundle.DocumentMetadata metadata(String scope) {
        return new DocumentBundle.DocumentMetadata("Report", "Acme", "2026-01-31", scope, null, "Type II", null);
    }

    private static DocumentBundle.AssessmentContext context(List<String> gaps) {
        return new DocumentBundle.AssessmentContext(null, gaps, null, null);
    }
}
