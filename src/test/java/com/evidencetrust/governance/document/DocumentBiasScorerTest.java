package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Severity;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;
import com.evidencetrust.input.RiskLevel;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DocumentBiasScorerTest {
    private final DocumentBiasScorer scorer = new DocumentBiasScorer();

    @Test
    void shouldPenalizePerfectPassRateAcrossTwelveControls() {
        List<Control> controls = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            controls.add(Control.of("CC-" + i, ControlStatus.EFFECTIVE, "Inspected configuration for control " + i));
        }

        CheckResult result = scorer.score(bundle(controls));

        assertEquals(75.0, result.score());
        assertEquals(1, result.findings().size());
        assertEquals(Severity.WARNING, result.findings().get(0).severity());
    }

    @Test
    void shouldNotPenalizePerfectPassRateOnSmallSample() {
        List<Control> controls = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            controls.add(Control.of("CC-" + i, ControlStatus.EFFECTIVE, "evidence"));
        }

        assertEquals(90.0, scorer.score(bundle(controls)).score());
    }

    @Test
    void shouldNoteUniformDeclaredSeverity() {
        List<Control> controls = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            controls.add(new Control("CC-" + i, "", i == 1 ? ControlStatus.INEFFECTIVE : ControlStatus.EFFECTIVE,
                    RiskLevel.MEDIUM, "evidence " + i, null, null, List.of(), null));
        }

        CheckResult result = scorer.score(bundle(controls));

        assertEquals(85.0, result.score());
        assertEquals(1, result.count(Severity.INFO));
    }

    @Test
    void shouldPenalizeUndocumentedFailures() {
        CheckResult result = scorer.score(bundle(List.of(
                Control.of("CC-1", ControlStatus.INEFFECTIVE, ""),
                Control.of("CC-2", ControlStatus.INEFFECTIVE, null),
                Control.of("CC-3", ControlStatus.INEFFECTIVE, "Exception noted: 2 of 25 samples lacked approval"))));

        assertEquals(80.0, result.score());
        assertEquals(List.of("CC-1", "CC-2"), result.findings().get(0).evidenceRefs());
    }

    static DocumentBundle bundle(List<Control> controls) {
        return new DocumentBundle(DocumentSource.SOC2, controls, null, null);
    }
}
