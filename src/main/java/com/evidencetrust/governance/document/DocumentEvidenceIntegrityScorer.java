package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.DocumentBundle;

public class DocumentEvidenceIntegrityScorer {
    static final int BASE_SCORE = 70;
    static final int FULL_COVERAGE_BONUS = 15;
    static final int MISSING_PENALTY = 5;
    static final int MIN_AVERAGE_LENGTH = 30;
    static final int THIN_EVIDENCE_PENALTY = 15;
    static final int BOILERPLATE_PENALTY = 10;
    static final int BOILERPLATE_PENALTY_CAP = 30;

    public CheckResult score(DocumentBundle bundle, Map<String, List<String>> boilerplate) {
        List<Control> controls = bundle.controls();
        List<Finding> findings = new ArrayList<>();
        int score = BASE_SCORE;

        long withEvidence = controls.stream().filter(Control::hasEvidence).count();
        if (withEvidence == controls.size()) {
            score += FULL_COVERAGE_BONUS;
        } else {
            long missing = controls.size() - withEvidence;
            score -= (int) missing * MISSING_PENALTY;
            findings.add(Finding.warning(
                    "EI-DOC-MISSING",
                    FindingCategory.EVIDENCE_INTEGRITY,
                    missing + " of " + controls.size() + " controls have no evidence",
                    "Ensure all in-scope controls have supporting evidence",
                    controls.stream().filter(c -> !c.hasEvidence()).map(Control::id).toList()));
        }

        if (!controls.isEmpty()) {
            double averageLength = controls.stream()
                    .mapToInt(c -> c.evidence() == null ? 0 : c.evidence().length())
                    .average()
                    .orElse(0);
            if (averageLength < MIN_AVERAGE_LENGTH) {
                score -= THIN_EVIDENCE_PENALTY;
                findings.add(Finding.warning(
                        "EI-DOC-THIN",
                        FindingCategory.EVIDENCE_INTEGRITY,
                        "Average evidence length is " + Math.round(averageLength) + " characters, which is very thin",
                        "Evidence should describe test procedures and results in detail"));
            }
        }

        int penalty = Math.min(BOILERPLATE_PENALTY_CAP, boilerplate.size() * BOILERPLATE_PENALTY);
        if (penalty > 0) {
            score -= penalty;
            findings.add(Finding.warning(
                    "EI-DOC-BOILERPLATE",
                    FindingCategory.EVIDENCE_INTEGRITY,
                    boilerplate.size() + " controls flagged for boilerplate or template evidence",
                    "Replace template evidence with specific test procedures and results",
                    List.copyOf(boilerplate.keySet())));
        }

        return CheckResult.of(score, findings);
    }
}
