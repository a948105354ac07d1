package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.DocumentSource;

/**
 * Verifies that a SOC 2 report carried the sections an AICPA report is expected to have.
 */
public class StructuralCompletenessCheck {
    private static final Map<String, Section> SECTIONS = new LinkedHashMap<>();

    static {
        SECTIONS.put("auditorReport", new Section("Independent Auditor's Report", DocumentBundle.StructuralSections::auditorReport));
        SECTIONS.put("managementAssertion", new Section("Management's Assertion", DocumentBundle.StructuralSections::managementAssertion));
        SECTIONS.put("systemDescription", new Section("System Description", DocumentBundle.StructuralSections::systemDescription));
        SECTIONS.put("controlMatrix", new Section("Trust Services Criteria & Controls", DocumentBundle.StructuralSections::controlMatrix));
        SECTIONS.put("testResults", new Section("Tests of Controls & Results", DocumentBundle.StructuralSections::testResults));
    }

    public List<Finding> check(DocumentBundle bundle) {
        if (bundle.source() != DocumentSource.SOC2) {
            return List.of();
        }
        DocumentBundle.StructuralSections sections = bundle.metadata().structuralSections();
        if (sections == null) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        SECTIONS.forEach((key, section) -> {
            if (!section.present().test(sections)) {
                findings.add(Finding.warning(
                        "SC-" + key,
                        FindingCategory.STRUCTURAL_COMPLETENESS,
                        "Missing SOC 2 section: " + section.label(),
                        "Verify the SOC 2 report includes the " + section.label() + " section"));
            }
        });
        return findings;
    }

    private record Section(String label, Predicate<DocumentBundle.StructuralSections> present) {
    }
}
