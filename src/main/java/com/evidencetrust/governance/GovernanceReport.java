package com.evidencetrust.governance;

import java.time.Instant;
import java.util.List;

public record GovernanceReport(
        String id,
        int confidenceScore,
        List<DimensionScore> dimensions,
        TrustTier trustTier,
        int totalFindings,
        SeverityCounts findingsBySeverity,
        String executiveSummary,
        Instant evaluatedAt,
        long durationMs,
        String modelUsed,
        String reportHash) {

    public GovernanceReport {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        reportHash = reportHash == null ? "" : reportHash;
    }

    public GovernanceReport withReportHash(String hash) {
        return new GovernanceReport(
                id,
                confidenceScore,
                dimensions,
                trustTier,
                totalFindings,
                findingsBySeverity,
                executiveSummary,
                evaluatedAt,
                durationMs,
                modelUsed,
                hash);
    }

    public DimensionScore dimension(Dimension dimension) {
        return dimensions.stream()
                .filter(score -> score.dimension() == dimension)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Report has no dimension " + dimension.key()));
    }

    public List<Finding> allFindings() {
        return dimensions.stream().flatMap(score -> score.findings().stream()).toList();
    }

    /** Confidence on the 0.0-1.0 scale embedded by credential issuers. */
    public double normalizedConfidence() {
        return confidenceScore / 100.0;
    }
}
