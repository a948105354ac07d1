package com.evidencetrust.evidence;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;
import com.evidencetrust.input.ProbeResult;

/**
 * Cross-references probe results against the identifiers recorded in evidence payloads.
 */
public class CorrelationChecker {
    private final String identifierField;

    public CorrelationChecker(String identifierField) {
        this.identifierField = identifierField;
    }

    public CheckResult check(List<EvidenceLog> logs, List<ProbeResult> probes) {
        if (probes.isEmpty()) {
            return CheckResult.of(100, List.of());
        }

        Set<String> recorded = recordedIdentifiers(logs);
        List<Finding> findings = new ArrayList<>();
        int matched = 0;
        for (ProbeResult probe : probes) {
            if (recorded.contains(probe.probeId())) {
                matched++;
            } else {
                findings.add(Finding.warning(
                        "CR-MISS-" + probe.probeId(),
                        FindingCategory.PROBE_EVIDENCE_CORRELATION,
                        "Probe " + probe.probeId() + " has no corresponding evidence record",
                        "Ensure every probe result is captured in the evidence log"));
            }
        }
        return CheckResult.of(100.0 * matched / probes.size(), findings);
    }

    Set<String> recordedIdentifiers(List<EvidenceLog> logs) {
        Set<String> identifiers = new HashSet<>();
        for (EvidenceLog evidenceLog : logs) {
            for (EvidenceRecord record : evidenceLog.records()) {
                String identifier = record.dataText(identifierField);
                if (identifier != null) {
                    identifiers.add(identifier);
                }
            }
        }
        return identifiers;
    }
}
