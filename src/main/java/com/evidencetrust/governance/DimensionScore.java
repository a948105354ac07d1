package com.evidencetrust.governance;

import java.util.List;
import java.util.Objects;

public record DimensionScore(
        Dimension dimension,
        double score,
        double weight,
        String rationale,
        List<Finding> findings) {

    public DimensionScore {
        Objects.requireNonNull(dimension, "dimension");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score out of range for " + dimension.key() + ": " + score);
        }
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
