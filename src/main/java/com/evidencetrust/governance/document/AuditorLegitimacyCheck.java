package com.evidencetrust.governance.document;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.DocumentBundle;

public class AuditorLegitimacyCheck {
    private static final List<String> GENERIC_NAMES = List.of(
            "the auditor", "audit firm", "auditor", "external auditor", "independent auditor");
    private static final Pattern FIRM_PATTERN = Pattern.compile(
            "\\b(LLP|LLC|&|Associates|Consulting|Partners|Group|Advisory|P\\.?C\\.?)\\b",
            Pattern.CASE_INSENSITIVE);

    public Optional<Finding> check(DocumentBundle.DocumentMetadata metadata) {
        String auditor = metadata.auditor();
        if (auditor == null || auditor.isBlank()) {
            return Optional.of(Finding.warning(
                    "AL-MISSING",
                    FindingCategory.AUDITOR_LEGITIMACY,
                    "Auditor name missing from report metadata",
                    "Verify the report includes the name of the CPA firm that performed the audit"));
        }

        String trimmed = auditor.trim();
        if (GENERIC_NAMES.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.of(Finding.warning(
                    "AL-GENERIC",
                    FindingCategory.AUDITOR_LEGITIMACY,
                    "Auditor name \"" + trimmed + "\" appears generic; expected a specific firm name",
                    "Report should identify the specific CPA firm (e.g. 'Deloitte & Touche LLP')"));
        }

        // "&" has no word boundary of its own, so it is matched separately.
        if (trimmed.contains("&") || FIRM_PATTERN.matcher(trimmed).find()) {
            return Optional.of(Finding.info(
                    "AL-FIRM",
                    FindingCategory.AUDITOR_LEGITIMACY,
                    "Auditor \"" + trimmed + "\" matches CPA firm naming pattern",
                    "No action needed"));
        }
        return Optional.empty();
    }
}
