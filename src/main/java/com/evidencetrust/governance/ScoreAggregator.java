package com.evidencetrust.governance;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weights dimension scores into a single confidence score and derives the trust tier and
 * executive summary from it.
 */
public class ScoreAggregator {
    private final GovernanceConfig config;

    public ScoreAggregator(GovernanceConfig config) {
        this.config = config;
    }

    public DimensionScore dimension(Dimension dimension, CheckResult result) {
        return dimension(dimension, result.score(), result.findings());
    }

    public DimensionScore dimension(Dimension dimension, double score, List<Finding> findings) {
        double clamped = CheckResult.clamp(score);
        return new DimensionScore(
                dimension,
                clamped,
                config.weight(dimension),
                rationale(dimension, clamped, findings),
                findings);
    }

    public List<DimensionScore> dimensions(Map<Dimension, CheckResult> results) {
        List<DimensionScore> dimensions = new ArrayList<>();
        for (Dimension dimension : Dimension.values()) {
            CheckResult result = results.get(dimension);
            if (result == null) {
                throw new IllegalStateException("No result for dimension " + dimension.key());
            }
            dimensions.add(dimension(dimension, result));
        }
        return dimensions;
    }

    public Aggregation aggregate(List<DimensionScore> dimensions) {
        int confidenceScore = confidenceScore(dimensions);
        TrustTier tier = TrustTier.forScore(confidenceScore, config.thresholds());
        SeverityCounts counts = SeverityCounts.tally(dimensions.stream().flatMap(d -> d.findings().stream()).toList());
        return new Aggregation(dimensions, confidenceScore, tier, executiveSummary(confidenceScore, tier, counts));
    }

    public int confidenceScore(List<DimensionScore> dimensions) {
        double weighted = 0.0;
        for (DimensionScore dimension : dimensions) {
            weighted += dimension.score() * dimension.weight();
        }
        return (int) Math.round(weighted);
    }

    static String rationale(Dimension dimension, double score, List<Finding> findings) {
        long criticals = findings.stream().filter(f -> f.severity() == Severity.CRITICAL).count();
        long warnings = findings.stream().filter(f -> f.severity() == Severity.WARNING).count();
        String formatted = formatScore(score);
        if (criticals > 0) {
            return dimension.key() + ": " + criticals + " critical issue(s) detected. Score: " + formatted + "/100.";
        }
        if (warnings > 0) {
            return dimension.key() + ": " + warnings + " warning(s) noted. Score: " + formatted + "/100.";
        }
        if (score >= 90.0) {
            return dimension.key() + ": Excellent, no significant issues. Score: " + formatted + "/100.";
        }
        return dimension.key() + ": Adequate with minor observations. Score: " + formatted + "/100.";
    }

    static String executiveSummary(int score, TrustTier tier, SeverityCounts counts) {
        String prefix = "Assessment achieved " + score + "/100 (" + tier.label().replace('-', ' ') + "). ";
        if (counts.critical() > 0) {
            return prefix + counts.critical() + " critical finding(s) require immediate attention.";
        }
        if (counts.warning() > 0) {
            return prefix + counts.warning() + " warning(s) identified for review.";
        }
        return prefix + "No significant issues detected.";
    }

    private static String formatScore(double score) {
        long rounded = Math.round(score);
        if (Math.abs(score - rounded) < 1e-9) {
            return Long.toString(rounded);
        }
        return String.format(Locale.ROOT, "%.1f", score);
    }

    public record Aggregation(
            List<DimensionScore> dimensions,
            int confidenceScore,
            TrustTier trustTier,
            String executiveSummary) {
    }
}
