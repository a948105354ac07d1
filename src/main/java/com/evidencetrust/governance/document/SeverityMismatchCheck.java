package com.evidencetrust.governance.document;

import java.util.List;
import java.util.Optional;

import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.EvidenceType;
import com.evidencetrust.input.RiskLevel;

public class SeverityMismatchCheck {

    public Optional<Finding> check(DocumentBundle bundle) {
        List<String> ids = bundle.controls().stream()
                .filter(control -> control.status() == ControlStatus.EFFECTIVE)
                .filter(control -> control.severity() == RiskLevel.CRITICAL || control.severity() == RiskLevel.HIGH)
                .filter(control -> weaklyEvidenced(control, bundle))
                .map(Control::id)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Finding.warning(
                "SM-DOC-WEAK-EVIDENCE",
                FindingCategory.METHODOLOGY,
                ids.size() + " high-risk control(s) marked effective rest only on document or attestation evidence",
                "Back critical and high-risk controls with scan or test evidence",
                ids));
    }

    private static boolean weaklyEvidenced(Control control, DocumentBundle bundle) {
        return EvidenceType.forTool(control.toolOr(bundle.source())).weak();
    }
}
