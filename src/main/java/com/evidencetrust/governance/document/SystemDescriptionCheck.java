package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.DocumentBundle;

/**
 * Checks the declared system inventory against the control evidence. Findings are split by the
 * dimension they bear on.
 */
public class SystemDescriptionCheck {
    private static final List<String> GENERIC_TERMS = List.of(
            "cloud provider", "identity system", "database", "monitoring", "server", "system");

    public Outcome check(DocumentBundle bundle) {
        DocumentBundle.AssessmentContext context = bundle.assessmentContext();
        List<DocumentBundle.TechStackEntry> techStack = context == null ? List.of() : context.techStack();
        if (techStack.isEmpty()) {
            return new Outcome(
                    List.of(Finding.warning(
                            "SD-EMPTY",
                            FindingCategory.SYSTEM_DESCRIPTION,
                            "No system description; cannot verify scope coverage",
                            "Include technology stack details (e.g. 'Okta for IdP', 'AWS for cloud')")),
                    List.of());
        }

        String allEvidence = bundle.controls().stream()
                .map(Control::evidence)
                .filter(evidence -> evidence != null)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);

        List<Finding> methodology = new ArrayList<>();
        List<Finding> integrity = new ArrayList<>();

        long referenced = techStack.stream()
                .map(SystemDescriptionCheck::technology)
                .filter(technology -> !technology.isEmpty() && allEvidence.contains(technology))
                .count();
        if (referenced == 0) {
            integrity.add(Finding.warning(
                    "SD-DISCONNECTED",
                    FindingCategory.SYSTEM_DESCRIPTION,
                    "System description disconnected from evidence; none of " + techStack.size()
                            + " tech stack entries appear in control evidence",
                    "Evidence should reference the specific systems being assessed"));
        }

        boolean allGeneric = techStack.stream()
                .map(SystemDescriptionCheck::technology)
                .allMatch(GENERIC_TERMS::contains);
        if (allGeneric) {
            methodology.add(Finding.info(
                    "SD-GENERIC",
                    FindingCategory.SYSTEM_DESCRIPTION,
                    "Tech stack contains only generic terms, no specific product names",
                    "Use specific product names (e.g. 'Okta' not 'identity system')"));
        }

        return new Outcome(methodology, integrity);
    }

    private static String technology(DocumentBundle.TechStackEntry entry) {
        return entry.technology() == null ? "" : entry.technology().trim().toLowerCase(Locale.ROOT);
    }

    public record Outcome(List<Finding> methodologyFindings, List<Finding> integrityFindings) {
        public Outcome {
            methodologyFindings = List.copyOf(methodologyFindings);
            integrityFindings = List.copyOf(integrityFindings);
        }
    }
}
