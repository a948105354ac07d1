package com.evidencetrust.governance;

import java.time.Duration;

/**
 * Caller's choice of external evaluator for one run. A {@code null} timeout defers to the
 * configured default.
 */
public record EnhancementRequest(String evaluatorName, Duration timeout) {
    public static final String DETERMINISTIC = "deterministic";

    public EnhancementRequest {
        evaluatorName = evaluatorName == null || evaluatorName.isBlank() ? DETERMINISTIC : evaluatorName.trim();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static EnhancementRequest none() {
        return new EnhancementRequest(DETERMINISTIC, null);
    }

    public static EnhancementRequest of(String evaluatorName) {
        return new EnhancementRequest(evaluatorName, null);
    }

    public static EnhancementRequest of(String evaluatorName, Duration timeout) {
        return new EnhancementRequest(evaluatorName, timeout);
    }

    public boolean engaged() {
        return !DETERMINISTIC.equalsIgnoreCase(evaluatorName);
    }
}
