package com.evidencetrust.governance;

import java.util.List;

/**
 * Score and findings produced by one deterministic check, clamped to [0, 100].
 */
public record CheckResult(double score, List<Finding> findings) {

    public CheckResult {
        score = clamp(score);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static CheckResult of(double score, List<Finding> findings) {
        return new CheckResult(score, findings);
    }

    public static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }

    public long count(Severity severity) {
        return findings.stream().filter(finding -> finding.severity() == severity).count();
    }
}
