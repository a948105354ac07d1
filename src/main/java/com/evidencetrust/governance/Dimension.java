package com.evidencetrust.governance;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The fixed set of governance axes a report is scored on.
 *
 * <p>Evidence integrity is objectively verifiable and is therefore never adjustable by an
 * external evaluator.
 */
public enum Dimension {
    METHODOLOGY(true, FindingCategory.METHODOLOGY),
    EVIDENCE_INTEGRITY(false, FindingCategory.EVIDENCE_INTEGRITY),
    COMPLETENESS(true, FindingCategory.COMPLETENESS),
    BIAS_DETECTION(true, FindingCategory.BIAS_DETECTION);

    private final boolean adjustable;
    private final FindingCategory category;

    Dimension(boolean adjustable, FindingCategory category) {
        this.adjustable = adjustable;
        this.category = category;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean adjustable() {
        return adjustable;
    }

    public FindingCategory category() {
        return category;
    }

    public static Dimension fromKey(String key) {
        for (Dimension dimension : values()) {
            if (dimension.key().equalsIgnoreCase(key.trim())) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown dimension: " + key);
    }
}
