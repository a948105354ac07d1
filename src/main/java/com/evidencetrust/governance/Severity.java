package com.evidencetrust.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
