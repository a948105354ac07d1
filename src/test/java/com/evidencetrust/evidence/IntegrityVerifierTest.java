package com.evidencetrust.evidence;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.Fixtures;
import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.Severity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntegrityVerifierTest {
    private final IntegrityVerifier verifier = new IntegrityVerifier();

    @Test
    void shouldAcceptValidChainsOfAnyLength() {
        for (int n = 0; n <= 5; n++) {
            String[] timestamps = new String[n];
            for (int i = 0; i < n; i++) {
                timestamps[i] = "2026-03-01T10:0" + i + ":00Z";
            }
            CheckResult result = verifier.check(List.of(Fixtures.log("log-" + n, timestamps)));

            assertEquals(100.0, result.score());
            assertEquals(0, result.count(Severity.CRITICAL));
        }
    }

    @Test
    void shouldReportFirstBreakWhenStoredHashIsAltered() {
        List<EvidenceRecord> records = new ArrayList<>(Fixtures.chain(
                "2026-03-01T10:00:00Z", "2026-03-01T10:01:00Z", "2026-03-01T10:02:00Z", "2026-03-01T10:03:00Z"));
        EvidenceRecord second = records.get(1);
        records.set(1, new EvidenceRecord(second.sequence(), second.timestamp(), second.operation(), second.data(),
                second.previousHash(), "0".repeat(64)));

        ChainVerification verification = verifier.verify(records);
        CheckResult result = verifier.check(List.of(EvidenceLog.of("tampered.jsonl", records)));

        assertFalse(verification.valid());
        assertEquals(2, verification.brokenAt());
        assertEquals(1, result.count(Severity.CRITICAL));
        assertEquals(70.0, result.score());
    }

    @Test
    void shouldCiteIndexFourWhenFourthPreviousHashIsTampered() {
        List<EvidenceRecord> records = new ArrayList<>(Fixtures.chain(
                "2026-03-01T10:00:00Z", "2026-03-01T10:01:00Z", "2026-03-01T10:02:00Z", "2026-03-01T10:03:00Z"));
        EvidenceRecord fourth = records.get(3);
        records.set(3, new EvidenceRecord(fourth.sequence(), fourth.timestamp(), fourth.operation(), fourth.data(),
                "f".repeat(64), fourth.hash()));

        CheckResult result = verifier.check(List.of(EvidenceLog.of("evidence.jsonl", records)));

        assertTrue(result.score() <= 70.0);
        Finding critical = result.findings().get(0);
        assertEquals(Severity.CRITICAL, critical.severity());
        assertTrue(critical.description().contains("record 4"), critical.description());
    }

    @Test
    void shouldDetectEditedPayload() {
        List<EvidenceRecord> records = new ArrayList<>(Fixtures.chain("2026-03-01T10:00:00Z", "2026-03-01T10:01:00Z"));
        EvidenceRecord first = records.get(0);
        records.set(0, new EvidenceRecord(first.sequence(), first.timestamp(), first.operation(),
                Fixtures.probeData("FORGED"), first.previousHash(), first.hash()));

        assertEquals(1, verifier.verify(records).brokenAt());
    }

    @Test
    void shouldFlagMissingAndMalformedLogs() {
        EvidenceLog malformed = new EvidenceLog("malformed.jsonl", true, Fixtures.chain("2026-03-01T10:00:00Z"), 2);

        CheckResult result = verifier.check(List.of(
                EvidenceLog.missing("missing.jsonl"),
                malformed,
                Fixtures.log("ok.jsonl", "2026-03-01T10:00:00Z")));

        assertEquals(2, result.count(Severity.CRITICAL));
        assertEquals(40.0, result.score());
        assertEquals(2, verifier.verify(malformed).brokenAt());
    }

    @Test
    void shouldScoreZeroWhenNoLogsAreNamed() {
        CheckResult result = verifier.check(List.of());

        assertEquals(0.0, result.score());
        assertEquals(1, result.count(Severity.CRITICAL));
    }
}
