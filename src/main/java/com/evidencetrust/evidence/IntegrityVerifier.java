package com.evidencetrust.evidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;

/**
 * Verifies hash-chained evidence logs. Records are never modified; the first break in a log ends
 * its verification.
 */
public class IntegrityVerifier {
    private static final Logger log = LoggerFactory.getLogger(IntegrityVerifier.class);
    private static final int CRITICAL_PENALTY = 30;

    public ChainVerification verify(List<EvidenceRecord> records) {
        String runningPreviousHash = null;
        for (int i = 0; i < records.size(); i++) {
            EvidenceRecord record = records.get(i);
            if (!Objects.equals(record.previousHash(), runningPreviousHash)) {
                return ChainVerification.brokenAt(records.size(), i + 1);
            }
            if (!EvidenceHashing.contentHash(record).equals(record.hash())) {
                return ChainVerification.brokenAt(records.size(), i + 1);
            }
            runningPreviousHash = record.hash();
        }
        return ChainVerification.intact(records.size());
    }

    public ChainVerification verify(EvidenceLog evidenceLog) {
        ChainVerification verification = verify(evidenceLog.records());
        if (verification.valid() && evidenceLog.malformed()) {
            return ChainVerification.brokenAt(evidenceLog.records().size(), evidenceLog.malformedAt());
        }
        return verification;
    }

    public CheckResult check(List<EvidenceLog> logs) {
        List<Finding> findings = new ArrayList<>();
        if (logs.isEmpty()) {
            findings.add(Finding.critical(
                    "EI-NO-LOGS",
                    FindingCategory.EVIDENCE_INTEGRITY,
                    "No evidence logs provided",
                    "Ensure the evidence collection phase produces evidence logs",
                    List.of()));
            return CheckResult.of(0, findings);
        }

        boolean allValid = true;
        for (int i = 0; i < logs.size(); i++) {
            EvidenceLog evidenceLog = logs.get(i);
            if (!evidenceLog.present()) {
                findings.add(Finding.critical(
                        "EI-MISSING-" + (i + 1),
                        FindingCategory.EVIDENCE_INTEGRITY,
                        "Evidence log not found: " + evidenceLog.name(),
                        "Re-run evidence collection to regenerate the log",
                        List.of(evidenceLog.name())));
                allValid = false;
                continue;
            }

            ChainVerification verification = verify(evidenceLog);
            if (!verification.valid()) {
                log.debug("Hash chain of {} broken at record {}", evidenceLog.name(), verification.brokenAt());
                findings.add(Finding.critical(
                        "EI-BROKEN-" + (i + 1),
                        FindingCategory.EVIDENCE_INTEGRITY,
                        "Hash chain broken at record " + verification.brokenAt() + " in " + evidenceLog.name(),
                        "Evidence may have been tampered with. Re-collect evidence.",
                        List.of(evidenceLog.name())));
                allValid = false;
            }
        }

        double score = allValid ? 100 : Math.max(0, 100 - CRITICAL_PENALTY * findings.size());
        return CheckResult.of(score, findings);
    }
}
