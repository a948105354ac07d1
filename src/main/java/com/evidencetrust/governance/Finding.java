package com.evidencetrust.governance;

import java.util.List;
import java.util.Objects;

public record Finding(
        String id,
        Severity severity,
        FindingCategory category,
        String description,
        String remediation,
        List<String> evidenceRefs,
        FindingOrigin origin) {

    public Finding {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(category, "category");
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
        origin = origin == null ? FindingOrigin.DETERMINISTIC : origin;
    }

    public static Finding critical(String id, FindingCategory category, String description, String remediation, List<String> refs) {
        return new Finding(id, Severity.CRITICAL, category, description, remediation, refs, FindingOrigin.DETERMINISTIC);
    }

    public static Finding warning(String id, FindingCategory category, String description, String remediation) {
        return warning(id, category, description, remediation, List.of());
    }

    public static Finding warning(String id, FindingCategory category, String description, String remediation, List<String> refs) {
        return new Finding(id, Severity.WARNING, category, description, remediation, refs, FindingOrigin.DETERMINISTIC);
    }

    public static Finding info(String id, FindingCategory category, String description, String remediation) {
        return info(id, category, description, remediation, List.of());
    }

    public static Finding info(String id, FindingCategory category, String description, String remediation, List<String> refs) {
        return new Finding(id, Severity.INFO, category, description, remediation, refs, FindingOrigin.DETERMINISTIC);
    }

    public Finding withId(String newId) {
        return new Finding(newId, severity, category, description, remediation, evidenceRefs, origin);
    }
}
