package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.EvidenceMethod;

public class DocumentMethodologyScorer {
    static final int BASE_SCORE = 50;
    static final int INQUIRY_CAP = 40;
    static final int NOTE_KEYWORD_BONUS = 3;
    private static final Map<EvidenceMethod, Integer> METHOD_BONUS = new EnumMap<>(EvidenceMethod.class);
    private static final List<String> NOTE_KEYWORDS = List.of(
            "reperform", "sample", "population", "walkthrough", "observed", "inspect", "examined");

    static {
        METHOD_BONUS.put(EvidenceMethod.REPERFORMANCE, 25);
        METHOD_BONUS.put(EvidenceMethod.AUTOMATED_TEST, 25);
        METHOD_BONUS.put(EvidenceMethod.INSPECTION, 15);
        METHOD_BONUS.put(EvidenceMethod.OBSERVATION, 10);
        METHOD_BONUS.put(EvidenceMethod.INQUIRY, 0);
        METHOD_BONUS.put(EvidenceMethod.UNKNOWN, 0);
        METHOD_BONUS.put(EvidenceMethod.NONE, -10);
    }

    public CheckResult score(DocumentBundle bundle, List<EvidenceMethod> methods) {
        List<Finding> findings = new ArrayList<>();
        double score = BASE_SCORE;

        if (!methods.isEmpty()) {
            int bonus = methods.stream().mapToInt(METHOD_BONUS::get).sum();
            score += Math.round((double) bonus / methods.size());

            long inquiry = methods.stream().filter(method -> method == EvidenceMethod.INQUIRY).count();
            if ((double) inquiry / methods.size() > 0.5) {
                score = Math.min(score, INQUIRY_CAP);
                findings.add(Finding.warning(
                        "MT-DOC-INQUIRY",
                        FindingCategory.METHODOLOGY,
                        "Majority of controls (" + inquiry + "/" + methods.size() + ") have inquiry-only evidence",
                        "Include inspection, observation, or reperformance evidence for higher assurance"));
            }
        }

        DocumentBundle.AssessmentContext context = bundle.assessmentContext();
        if (context != null && context.assessorNotes() != null) {
            String notes = context.assessorNotes().toLowerCase(Locale.ROOT);
            long matches = NOTE_KEYWORDS.stream().filter(notes::contains).count();
            score += matches * NOTE_KEYWORD_BONUS;
        }

        return CheckResult.of(score, findings);
    }
}
