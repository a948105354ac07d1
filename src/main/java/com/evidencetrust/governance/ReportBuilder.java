package com.evidencetrust.governance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ReportBuilder {
    private final Clock clock;
    private final ReportHasher hasher;

    public ReportBuilder(Clock clock, ReportHasher hasher) {
        this.clock = clock;
        this.hasher = hasher;
    }

    public GovernanceReport build(
            ScoreAggregator.Aggregation aggregation,
            String narrative,
            String modelUsed,
            Instant startedAt) {
        Instant evaluatedAt = clock.instant();
        List<DimensionScore> dimensions = withUniqueFindingIds(aggregation.dimensions());
        List<Finding> allFindings = dimensions.stream().flatMap(d -> d.findings().stream()).toList();
        SeverityCounts counts = SeverityCounts.tally(allFindings);

        String summary = aggregation.executiveSummary();
        if (narrative != null && !narrative.isBlank()) {
            summary = summary + " External review: " + narrative.trim();
        }

        GovernanceReport unhashed = new GovernanceReport(
                "gov-" + evaluatedAt.toEpochMilli(),
                aggregation.confidenceScore(),
                dimensions,
                aggregation.trustTier(),
                allFindings.size(),
                counts,
                summary,
                evaluatedAt,
                Math.max(0L, Duration.between(startedAt, evaluatedAt).toMillis()),
                modelUsed,
                "");
        return unhashed.withReportHash(hasher.hash(unhashed));
    }

    private static List<DimensionScore> withUniqueFindingIds(List<DimensionScore> dimensions) {
        Set<String> seen = new HashSet<>();
        List<DimensionScore> out = new ArrayList<>();
        for (DimensionScore dimension : dimensions) {
            List<Finding> findings = new ArrayList<>();
            for (Finding finding : dimension.findings()) {
                String id = finding.id();
                int suffix = 2;
                while (!seen.add(id)) {
                    id = finding.id() + "-" + suffix++;
                }
                findings.add(id.equals(finding.id()) ? finding : finding.withId(id));
            }
            out.add(new DimensionScore(dimension.dimension(), dimension.score(), dimension.weight(), dimension.rationale(), findings));
        }
        return out;
    }
}
