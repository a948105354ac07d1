package com.evidencetrust.evidence;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Appends correctly linked records in memory. Used by evidence producers and fixtures.
 */
public class EvidenceChainBuilder {
    private final List<EvidenceRecord> records = new ArrayList<>();
    private int sequence;
    private String lastHash;

    public EvidenceRecord append(String timestamp, String operation, JsonNode data) {
        sequence++;
        EvidenceRecord unsigned = new EvidenceRecord(sequence, timestamp, operation, data, lastHash, null);
        String hash = EvidenceHashing.contentHash(unsigned);
        EvidenceRecord record = new EvidenceRecord(sequence, timestamp, operation, data, lastHash, hash);
        records.add(record);
        lastHash = hash;
        return record;
    }

    public List<EvidenceRecord> records() {
        return List.copyOf(records);
    }
}
