package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.RiskLevel;

public class DocumentBiasScorer {
    static final int BASE_SCORE = 90;
    static final int ALL_PASS_MIN_CONTROLS = 10;
    static final int ALL_PASS_PENALTY = 15;
    static final int UNIFORM_SEVERITY_MIN_CONTROLS = 5;
    static final int UNIFORM_SEVERITY_PENALTY = 5;
    static final int UNDOCUMENTED_FAILURE_PENALTY = 10;

    public CheckResult score(DocumentBundle bundle) {
        List<Control> controls = bundle.controls();
        List<Finding> findings = new ArrayList<>();
        int score = BASE_SCORE;

        long effective = controls.stream().filter(c -> c.status() == ControlStatus.EFFECTIVE).count();
        if (controls.size() >= ALL_PASS_MIN_CONTROLS && effective == controls.size()) {
            score -= ALL_PASS_PENALTY;
            findings.add(Finding.warning(
                    "BD-DOC-ALL-PASS",
                    FindingCategory.BIAS_DETECTION,
                    "All " + controls.size() + " controls are effective; a 100% pass rate across "
                            + ALL_PASS_MIN_CONTROLS + "+ controls is statistically unusual",
                    "Verify testing rigor was sufficient to detect failures"));
        }

        List<RiskLevel> severities = controls.stream().map(Control::severity).filter(Objects::nonNull).toList();
        if (severities.size() >= UNIFORM_SEVERITY_MIN_CONTROLS && severities.stream().distinct().count() == 1) {
            score -= UNIFORM_SEVERITY_PENALTY;
            findings.add(Finding.info(
                    "BD-DOC-UNIFORM-SEVERITY",
                    FindingCategory.BIAS_DETECTION,
                    "All " + severities.size() + " controls have the same severity (" + severities.get(0).label()
                            + "), which may indicate mechanical classification",
                    "Verify severity was assigned based on actual risk, not a template"));
        }

        List<String> undocumentedFailures = controls.stream()
                .filter(c -> c.status() == ControlStatus.INEFFECTIVE && !c.hasEvidence())
                .map(Control::id)
                .toList();
        if (!undocumentedFailures.isEmpty()) {
            score -= UNDOCUMENTED_FAILURE_PENALTY;
            findings.add(Finding.warning(
                    "BD-DOC-UNDOCUMENTED-FAILURE",
                    FindingCategory.BIAS_DETECTION,
                    undocumentedFailures.size() + " ineffective controls have no evidence of the failure",
                    "All exceptions should include evidence of the deficiency",
                    undocumentedFailures));
        }

        return CheckResult.of(score, findings);
    }
}
