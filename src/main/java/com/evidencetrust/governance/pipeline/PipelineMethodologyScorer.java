package com.evidencetrust.governance.pipeline;

import java.util.ArrayList;
import java.util.List;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.PipelineBundle;

/**
 * Penalizes every expected upstream phase or planning artifact that is absent from the bundle.
 */
public class PipelineMethodologyScorer {
    static final int NO_DRIFT_PENALTY = 20;
    static final int NO_PROBE_PENALTY = 20;
    static final int NO_MAPPING_PENALTY = 15;
    static final int NO_THREAT_MODEL_PENALTY = 10;
    static final int NO_CRITERIA_PENALTY = 10;

    public CheckResult score(PipelineBundle bundle) {
        List<Finding> findings = new ArrayList<>();
        int score = 100;

        if (bundle.driftResults().isEmpty()) {
            findings.add(Finding.warning(
                    "MT-NO-DRIFT",
                    FindingCategory.METHODOLOGY,
                    "No drift detection results found",
                    "Include the drift detection phase in the assessment pipeline"));
            score -= NO_DRIFT_PENALTY;
        }
        if (bundle.probeResults().isEmpty()) {
            findings.add(Finding.warning(
                    "MT-NO-PROBES",
                    FindingCategory.METHODOLOGY,
                    "No attack simulation results found",
                    "Include the attack simulation phase in the assessment pipeline"));
            score -= NO_PROBE_PENALTY;
        }
        if (bundle.mappingResults().isEmpty()) {
            findings.add(Finding.warning(
                    "MT-NO-MAPPING",
                    FindingCategory.METHODOLOGY,
                    "No compliance mapping results found",
                    "Include the compliance mapping phase in the assessment pipeline"));
            score -= NO_MAPPING_PENALTY;
        }
        if (bundle.threatModel() == null) {
            findings.add(Finding.info(
                    "MT-NO-THREAT-MODEL",
                    FindingCategory.METHODOLOGY,
                    "No threat model used to drive the assessment",
                    "Use structured threat modeling to systematically identify attack vectors"));
            score -= NO_THREAT_MODEL_PENALTY;
        }
        if (bundle.criteria().isEmpty()) {
            findings.add(Finding.info(
                    "MT-NO-CRITERIA",
                    FindingCategory.METHODOLOGY,
                    "No success criteria defined",
                    "Define binary, testable criteria for each control"));
            score -= NO_CRITERIA_PENALTY;
        }

        return CheckResult.of(score, findings);
    }
}
