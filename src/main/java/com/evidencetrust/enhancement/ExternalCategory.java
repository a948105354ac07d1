package com.evidencetrust.enhancement;

import java.util.Locale;
import java.util.Optional;

/**
 * Finding categories an external evaluator may use. {@link #BIAS} is an accepted alias.
 */
public enum ExternalCategory {
    METHODOLOGY,
    COMPLETENESS,
    BIAS_DETECTION,
    BIAS;

    public static Optional<ExternalCategory> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (ExternalCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
