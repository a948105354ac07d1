package com.evidencetrust.governance.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.governance.GovernanceConfig;
import com.evidencetrust.input.PipelineBundle;
import com.evidencetrust.input.ProbeResult;
import com.evidencetrust.input.RiskLevel;

/**
 * Flags result distributions that are too uniform to be credible.
 */
public class PipelineBiasScorer {
    private final GovernanceConfig.BiasPolicy policy;

    public PipelineBiasScorer(GovernanceConfig.BiasPolicy policy) {
        this.policy = policy;
    }

    public CheckResult score(PipelineBundle bundle) {
        List<Finding> findings = new ArrayList<>();
        int score = 100;

        List<ProbeResult> probes = bundle.probeResults();
        if (probes.size() >= policy.minProbeSample()) {
            if (probes.stream().noneMatch(ProbeResult::succeeded)) {
                findings.add(Finding.info(
                        "BD-ALL-BLOCKED",
                        FindingCategory.BIAS_DETECTION,
                        "All attacks were blocked; verify testing intensity was adequate",
                        "Consider increasing attack intensity or adding more vectors"));
                score -= policy.allBlockedPenalty();
            }
            if (probes.stream().allMatch(ProbeResult::succeeded)) {
                findings.add(Finding.warning(
                        "BD-ALL-SUCCEEDED",
                        FindingCategory.BIAS_DETECTION,
                        "All attacks succeeded; verify controls were actually tested",
                        "Review whether controls exist but were bypassed or testing was superficial"));
                score -= policy.allSucceededPenalty();
            }
        }

        List<PipelineBundle.DriftFinding> driftFindings = bundle.driftFindings();
        if (driftFindings.size() >= policy.minDriftFindings()) {
            long distinct = driftFindings.stream().map(PipelineBundle.DriftFinding::severity).distinct().count();
            if (distinct == 1) {
                RiskLevel level = driftFindings.get(0).severity();
                String severity = level == null ? "unspecified" : level.label();
                findings.add(Finding.info(
                        "BD-UNIFORM-SEVERITY",
                        FindingCategory.BIAS_DETECTION,
                        "All " + driftFindings.size() + " drift findings have the same severity (" + severity + ")",
                        "Review whether severity classification reflects actual risk"));
                score -= policy.uniformSeverityPenalty();
            }
        }

        return CheckResult.of(score, findings);
    }
}
