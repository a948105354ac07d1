package com.evidencetrust.governance.document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentEvidenceIntegrityScorerTest {
    private static final String DETAILED = "Inspected the quarterly access review export and traced removals to HR tickets";

    private final DocumentEvidenceIntegrityScorer scorer = new DocumentEvidenceIntegrityScorer();

    @Test
    void shouldRewardFullEvidenceCoverage() {
        CheckResult result = scorer.score(bundle(
                Control.of("A", ControlStatus.EFFECTIVE, DETAILED),
                Control.of("B", ControlStatus.EFFECTIVE, DETAILED + " for production")), Map.of());

        assertEquals(85.0, result.score());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void shouldPenalizeMissingAndThinEvidence() {
        CheckResult result = scorer.score(bundle(
                Control.of("A", ControlStatus.EFFECTIVE, "ok"),
                Control.of("B", ControlStatus.EFFECTIVE, ""),
                Control.of("C", ControlStatus.EFFECTIVE, null)), Map.of());

        // 70 - 2*5 - 15
        assertEquals(45.0, result.score());
        assertEquals(List.of("B", "C"), result.findings().get(0).evidenceRefs());
    }

    @Test
    void shouldCapBoilerplatePenalty() {
        Map<String, List<String>> boilerplate = new LinkedHashMap<>();
        for (String id : List.of("A", "B", "C", "D", "E")) {
            boilerplate.put(id, List.of("template-phrase"));
        }

        CheckResult result = scorer.score(bundle(Control.of("A", ControlStatus.EFFECTIVE, DETAILED)), boilerplate);

        assertEquals(55.0, result.score());
    }

    private static DocumentBundle bundle(Control... controls) {
        return new DocumentBundle(DocumentSource.ISO27001, List.of(controls), null, null);
    }
}
