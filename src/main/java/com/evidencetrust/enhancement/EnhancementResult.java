package com.evidencetrust.enhancement;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.governance.Dimension;

/**
 * Raw output of an external evaluator. Adjustments for dimensions that are not adjustable are
 * discarded on construction.
 */
public record EnhancementResult(Map<Dimension, Double> adjustments, List<ExternalFinding> findings, String narrative) {
    private static final Logger log = LoggerFactory.getLogger(EnhancementResult.class);

    public EnhancementResult {
        EnumMap<Dimension, Double> accepted = new EnumMap<>(Dimension.class);
        if (adjustments != null) {
            adjustments.forEach((dimension, value) -> {
                if (value == null || !Double.isFinite(value)) {
                    throw new EnhancementException("Adjustment for " + dimension.key() + " is not a finite number");
                }
                if (!dimension.adjustable()) {
                    log.warn("Ignoring external adjustment for non-adjustable dimension {}", dimension.key());
                    return;
                }
                accepted.put(dimension, value);
            });
        }
        adjustments = Collections.unmodifiableMap(accepted);
        findings = findings == null ? List.of() : List.copyOf(findings);
        narrative = narrative == null ? "" : narrative;
    }
}
