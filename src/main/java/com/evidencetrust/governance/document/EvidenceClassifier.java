package com.evidencetrust.governance.document;

import java.util.List;
import java.util.Locale;

import com.evidencetrust.input.Control;
import com.evidencetrust.input.EvidenceMethod;

/**
 * Determines the evidence-collection technique of a control. An upstream classification wins;
 * otherwise the evidence text is matched against technique keywords, strongest technique first.
 */
public class EvidenceClassifier {
    private static final List<String> REPERFORMANCE = List.of("reperform", "re-perform", "recalculat", "recomput");
    private static final List<String> AUTOMATED = List.of("automated", "script", "scan", "query", "caat", "tool output");
    private static final List<String> INSPECTION = List.of("inspect", "examined", "reviewed", "screenshot", "configuration export");
    private static final List<String> OBSERVATION = List.of("observ", "walkthrough", "walk-through", "witness");
    private static final List<String> INQUIRY = List.of("inquir", "interview", "discussed with", "confirmed with", "per management");

    public EvidenceMethod classify(Control control) {
        if (control.method() != null) {
            return control.method();
        }
        if (!control.hasEvidence()) {
            return EvidenceMethod.NONE;
        }
        String text = control.evidence().toLowerCase(Locale.ROOT);
        if (containsAny(text, REPERFORMANCE)) {
            return EvidenceMethod.REPERFORMANCE;
        }
        if (containsAny(text, AUTOMATED)) {
            return EvidenceMethod.AUTOMATED_TEST;
        }
        if (containsAny(text, INSPECTION)) {
            return EvidenceMethod.INSPECTION;
        }
        if (containsAny(text, OBSERVATION)) {
            return EvidenceMethod.OBSERVATION;
        }
        if (containsAny(text, INQUIRY)) {
            return EvidenceMethod.INQUIRY;
        }
        return EvidenceMethod.UNKNOWN;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
