package com.evidencetrust.governance.document;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.governance.Severity;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SystemDescriptionCheckTest {
    private final SystemDescriptionCheck check = new SystemDescriptionCheck();

    @Test
    void shouldWarnWhenInventoryIsAbsent() {
        SystemDescriptionCheck.Outcome outcome = check.check(bundle("MFA enforced in Okta", List.of()));

        assertEquals(1, outcome.methodologyFindings().size());
        assertEquals(Severity.WARNING, outcome.methodologyFindings().get(0).severity());
        assertTrue(outcome.integrityFindings().isEmpty());
    }

    @Test
    void shouldFlagDisconnectedDescription() {
        SystemDescriptionCheck.Outcome outcome = check.check(bundle(
                "Reviewed the user listing",
                List.of(new DocumentBundle.TechStackEntry("identity", "Okta", "in-scope"))));

        assertEquals(1, outcome.integrityFindings().size());
        assertTrue(outcome.integrityFindings().get(0).description().contains("disconnected"));
        assertTrue(outcome.methodologyFindings().isEmpty());
    }

    @Test
    void shouldNoteGenericOnlyInventory() {
        SystemDescriptionCheck.Outcome outcome = check.check(bundle(
                "Backups of the database are tested quarterly",
                List.of(new DocumentBundle.TechStackEntry("storage", "Database", null))));

        assertTrue(outcome.integrityFindings().isEmpty());
        assertEquals(Severity.INFO, outcome.methodologyFindings().get(0).severity());
    }

    @Test
    void shouldAcceptSpecificReferencedInventory() {
        SystemDescriptionCheck.Outcome outcome = check.check(bundle(
                "MFA enforced in Okta; CloudTrail enabled in AWS",
                List.of(
                        new DocumentBundle.TechStackEntry("identity", "Okta", null),
                        new DocumentBundle.TechStackEntry("cloud", "AWS", null))));

        assertTrue(outcome.methodologyFindings().isEmpty());
        assertTrue(outcome.integrityFindings().isEmpty());
    }

    private static DocumentBundle bundle(String evidence, List<DocumentBundle.TechStackEntry> techStack) {
        return new DocumentBundle(
                DocumentSource.SOC2,
                List.of(Control.of("CC6.1", ControlStatus.EFFECTIVE, evidence)),
                null,
                new DocumentBundle.AssessmentContext(techStack, null, null, null));
    }
}
