package com.evidencetrust.enhancement;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Dimension;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingOrigin;
import com.evidencetrust.governance.Severity;

/**
 * Folds an external evaluator's result into the deterministic baseline: bounded score
 * adjustments plus routed findings tagged as external.
 */
public class EnhancementApplier {
    private static final Logger log = LoggerFactory.getLogger(EnhancementApplier.class);

    private final AdjustmentBounds bounds;
    private final FindingRouter router;

    public EnhancementApplier(AdjustmentBounds bounds, FindingRouter router) {
        this.bounds = bounds;
        this.router = router;
    }

    public Map<Dimension, CheckResult> apply(Map<Dimension, CheckResult> baseline, EnhancementResult result) {
        Map<Dimension, List<Finding>> routed = new EnumMap<>(Dimension.class);
        for (ExternalFinding external : result.findings()) {
            Optional<Dimension> target = router.route(external.category());
            Optional<Severity> severity = severity(external.severity());
            if (target.isEmpty() || severity.isEmpty()) {
                log.debug("Dropping external finding with category={} severity={}", external.category(), external.severity());
                continue;
            }
            List<Finding> findings = routed.computeIfAbsent(target.get(), d -> new ArrayList<>());
            Dimension dimension = target.get();
            findings.add(new Finding(
                    "EXT-" + dimension.key() + "-" + (findings.size() + 1),
                    severity.get(),
                    dimension.category(),
                    external.description(),
                    external.remediation(),
                    List.of(),
                    FindingOrigin.EXTERNAL));
        }

        Map<Dimension, CheckResult> enhanced = new EnumMap<>(Dimension.class);
        baseline.forEach((dimension, base) -> {
            double score = base.score();
            Double adjustment = result.adjustments().get(dimension);
            if (adjustment != null && dimension.adjustable()) {
                score = bounds.apply(score, adjustment);
            }
            List<Finding> findings = new ArrayList<>(base.findings());
            findings.addAll(routed.getOrDefault(dimension, List.of()));
            enhanced.put(dimension, CheckResult.of(score, findings));
        });
        return enhanced;
    }

    private static Optional<Severity> severity(String label) {
        try {
            return Optional.of(Severity.fromLabel(label));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
