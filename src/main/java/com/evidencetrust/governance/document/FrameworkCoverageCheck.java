package com.evidencetrust.governance.document;

import java.util.List;
import java.util.Optional;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.DocumentBundle;

public class FrameworkCoverageCheck {

    public Optional<Finding> check(DocumentBundle bundle) {
        List<String> unmapped = bundle.controls().stream()
                .filter(control -> control.frameworkRefs().isEmpty())
                .map(Control::id)
                .distinct()
                .toList();
        if (unmapped.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Finding.info(
                "FC-DOC-UNMAPPED",
                FindingCategory.FRAMEWORK_COVERAGE,
                unmapped.size() + " control(s) have no framework mapping",
                "Map each control to at least one framework requirement (e.g. SOC 2 CC6.1, ISO 27001 A.8.2)",
                unmapped));
    }
}
