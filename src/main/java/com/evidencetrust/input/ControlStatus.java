package com.evidencetrust.input;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ControlStatus {
    EFFECTIVE("effective"),
    INEFFECTIVE("ineffective"),
    NOT_TESTED("not-tested");

    private final String label;

    ControlStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Partially compliant and non-compliant controls both score as ineffective.
     */
    @JsonCreator
    public static ControlStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return NOT_TESTED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        return switch (normalized) {
            case "effective", "pass", "passed", "compliant" -> EFFECTIVE;
            case "ineffective", "fail", "failed", "non-compliant", "partially-compliant", "partial" -> INEFFECTIVE;
            case "not-tested", "skipped", "not-applicable" -> NOT_TESTED;
            default -> throw new IllegalArgumentException("Unknown control status: " + value);
        };
    }
}
