package com.evidencetrust.input;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Evidence-collection technique, strongest first.
 */
public enum EvidenceMethod {
    REPERFORMANCE,
    AUTOMATED_TEST,
    INSPECTION,
    OBSERVATION,
    INQUIRY,
    UNKNOWN,
    NONE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @JsonCreator
    public static EvidenceMethod fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("CAAT".equals(normalized)) {
            return AUTOMATED_TEST;
        }
        return valueOf(normalized);
    }
}
