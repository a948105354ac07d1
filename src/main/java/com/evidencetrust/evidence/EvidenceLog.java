package com.evidencetrust.evidence;

import java.util.List;

/**
 * A named evidence log as read once for a run.
 *
 * @param present     false when the named log does not exist
 * @param records     the readable records, in file order
 * @param malformedAt 1-based position of the first unreadable entry, or 0 when every entry parsed
 */
public record EvidenceLog(String name, boolean present, List<EvidenceRecord> records, int malformedAt) {

    public EvidenceLog {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static EvidenceLog missing(String name) {
        return new EvidenceLog(name, false, List.of(), 0);
    }

    public static EvidenceLog of(String name, List<EvidenceRecord> records) {
        return new EvidenceLog(name, true, records, 0);
    }

    public boolean malformed() {
        return malformedAt > 0;
    }
}
