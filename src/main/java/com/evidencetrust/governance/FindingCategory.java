package com.evidencetrust.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingCategory {
    METHODOLOGY,
    EVIDENCE_INTEGRITY,
    COMPLETENESS,
    BIAS_DETECTION,
    TIMESTAMP_CONSISTENCY,
    PROBE_EVIDENCE_CORRELATION,
    AUDITOR_LEGITIMACY,
    SYSTEM_DESCRIPTION,
    STRUCTURAL_COMPLETENESS,
    CONSISTENCY,
    EVIDENCE_RECENCY,
    FRAMEWORK_COVERAGE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
