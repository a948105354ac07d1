package com.evidencetrust.governance.document;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.evidencetrust.input.Control;

/**
 * Flags controls whose evidence looks templated: upstream flags, placeholder phrases, or the
 * same evidence text copied across several controls.
 */
public class BoilerplateDetector {
    static final String TEMPLATE_PHRASE = "template-phrase";
    static final String DUPLICATE_EVIDENCE = "duplicate-evidence";
    private static final int DUPLICATE_THRESHOLD = 3;
    private static final List<String> PLACEHOLDERS = List.of(
            "lorem ipsum",
            "[insert",
            "<insert",
            "[company",
            "<company",
            "tbd",
            "to be determined",
            "placeholder");

    /**
     * @return flags per control id, containing only controls with at least one flag
     */
    public Map<String, List<String>> detect(List<Control> controls) {
        Map<String, Integer> textCounts = new HashMap<>();
        for (Control control : controls) {
            if (control.hasEvidence()) {
                textCounts.merge(normalize(control.evidence()), 1, Integer::sum);
            }
        }

        Map<String, List<String>> flagged = new LinkedHashMap<>();
        for (Control control : controls) {
            List<String> flags = new ArrayList<>(control.boilerplateFlags());
            if (control.hasEvidence()) {
                String text = normalize(control.evidence());
                if (PLACEHOLDERS.stream().anyMatch(text::contains)) {
                    flags.add(TEMPLATE_PHRASE);
                }
                if (textCounts.getOrDefault(text, 0) >= DUPLICATE_THRESHOLD) {
                    flags.add(DUPLICATE_EVIDENCE);
                }
            }
            if (!flags.isEmpty()) {
                flagged.put(control.id(), List.copyOf(flags));
            }
        }
        return flagged;
    }

    private static String normalize(String evidence) {
        return evidence.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
