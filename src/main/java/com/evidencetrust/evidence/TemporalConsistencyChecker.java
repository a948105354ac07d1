package com.evidencetrust.evidence;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.FindingCategory;

public class TemporalConsistencyChecker {
    private static final int ORDERING_PENALTY = 15;
    private static final int GAP_PENALTY = 5;

    private final Duration collectionWindow;

    public TemporalConsistencyChecker(Duration collectionWindow) {
        this.collectionWindow = collectionWindow;
    }

    public CheckResult check(List<EvidenceLog> logs) {
        List<Finding> findings = new ArrayList<>();
        int score = 100;

        for (int logIndex = 0; logIndex < logs.size(); logIndex++) {
            EvidenceLog evidenceLog = logs.get(logIndex);
            List<EvidenceRecord> records = evidenceLog.records();
            if (!evidenceLog.present() || records.size() < 2) {
                continue;
            }

            Instant first = null;
            Instant last = null;
            Instant previous = null;
            String previousRaw = null;
            int unparseable = 0;
            for (int i = 0; i < records.size(); i++) {
                String raw = records.get(i).timestamp();
                Instant current = Timestamps.parse(raw);
                if (current == null) {
                    unparseable++;
                    continue;
                }
                if (first == null) {
                    first = current;
                }
                last = current;

                if (previous != null && current.isBefore(previous)) {
                    findings.add(Finding.warning(
                            "TS-ORDER-" + (logIndex + 1) + "-" + (i + 1),
                            FindingCategory.TIMESTAMP_CONSISTENCY,
                            "Out-of-order timestamp at record " + (i + 1) + " in " + evidenceLog.name() + ": "
                                    + raw + " is before " + previousRaw,
                            "Investigate clock drift or evidence manipulation",
                            List.of(evidenceLog.name())));
                    score = Math.max(0, score - ORDERING_PENALTY);
                }
                previous = current;
                previousRaw = raw;
            }

            if (unparseable > 0) {
                findings.add(Finding.info(
                        "TS-UNPARSEABLE-" + (logIndex + 1),
                        FindingCategory.TIMESTAMP_CONSISTENCY,
                        unparseable + " of " + records.size() + " records in " + evidenceLog.name()
                                + " have timestamps that are not ISO-8601 and were excluded from ordering checks",
                        "Record evidence timestamps in ISO-8601 form",
                        List.of(evidenceLog.name())));
            }

            if (first != null && Duration.between(first, last).compareTo(collectionWindow) > 0) {
                double hours = Duration.between(first, last).toMillis() / 3_600_000.0;
                findings.add(Finding.info(
                        "TS-GAP-" + (logIndex + 1),
                        FindingCategory.TIMESTAMP_CONSISTENCY,
                        String.format(Locale.ROOT, "Large time gap (%.1fh) between first and last records in %s", hours, evidenceLog.name()),
                        "Consider collecting evidence in shorter time windows",
                        List.of(evidenceLog.name())));
                score = Math.max(0, score - GAP_PENALTY);
            }
        }

        return CheckResult.of(score, findings);
    }
}
