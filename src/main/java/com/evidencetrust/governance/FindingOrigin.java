package com.evidencetrust.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingOrigin {
    DETERMINISTIC,
    EXTERNAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
