package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.List;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.DocumentBundle;

public class DocumentCompletenessScorer {
    static final int BASE_SCORE = 60;
    static final int FULL_COVERAGE_BONUS = 25;
    static final int PARTIAL_COVERAGE_WEIGHT = 20;
    static final int TOLERATED_GAPS = 3;
    static final int DISCLOSURE_BONUS = 10;
    static final int EXCESS_GAP_PENALTY = 3;
    static final int DETAILED_SCOPE_LENGTH = 20;
    static final int DETAILED_SCOPE_BONUS = 5;

    public CheckResult score(DocumentBundle bundle) {
        List<Control> controls = bundle.controls();
        List<Finding> findings = new ArrayList<>();
        double score = BASE_SCORE;

        long withEvidence = controls.stream().filter(Control::hasEvidence).count();
        if (withEvidence == controls.size()) {
            score += FULL_COVERAGE_BONUS;
        } else {
            score += Math.round((double) withEvidence / controls.size() * PARTIAL_COVERAGE_WEIGHT);
        }

        DocumentBundle.AssessmentContext context = bundle.assessmentContext();
        int gapCount = context == null ? 0 : context.gaps().size();
        if (gapCount > 0 && gapCount <= TOLERATED_GAPS) {
            score += DISCLOSURE_BONUS;
        } else if (gapCount > TOLERATED_GAPS) {
            score -= (gapCount - TOLERATED_GAPS) * EXCESS_GAP_PENALTY;
            findings.add(Finding.info(
                    "CO-DOC-GAPS",
                    FindingCategory.COMPLETENESS,
                    gapCount + " scope gaps identified, indicating significant exclusions",
                    "Review whether excluded areas represent material risk"));
        }

        String scope = bundle.metadata().scope();
        if (scope != null && scope.length() > DETAILED_SCOPE_LENGTH) {
            score += DETAILED_SCOPE_BONUS;
        }

        return CheckResult.of(score, findings);
    }
}
