package com.evidencetrust.governance.document;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.governance.Severity;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameworkCoverageCheckTest {
    private final FrameworkCoverageCheck check = new FrameworkCoverageCheck();

    @Test
    void shouldListControlsWithoutFrameworkMapping() {
        Finding finding = check.check(bundle(
                control("A", List.of("SOC2:CC6.1")),
                control("B", List.of()),
                control("C", Arrays.asList(" ", null)))).orElseThrow();

        assertEquals("FC-DOC-UNMAPPED", finding.id());
        assertEquals(Severity.INFO, finding.severity());
        assertEquals(FindingCategory.FRAMEWORK_COVERAGE, finding.category());
        assertEquals(List.of("B", "C"), finding.evidenceRefs());
    }

    @Test
    void shouldStayQuietWhenEveryControlIsMapped() {
        assertTrue(check.check(bundle(
                control("A", List.of("SOC2:CC6.1")),
                control("B", List.of("ISO27001:A.8.2")))).isEmpty());
        assertTrue(check.check(bundle()).isEmpty());
    }

    private static Control control(String id, List<String> frameworks) {
        return new Control(id, "", ControlStatus.EFFECTIVE, null, "Inspected the policy", null, List.of(), frameworks, null);
    }

    private static DocumentBundle bundle(Control... controls) {
        return new DocumentBundle(DocumentSource.MANUAL, List.of(controls), null, null);
    }
}
