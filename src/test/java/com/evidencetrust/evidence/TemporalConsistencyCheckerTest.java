package com.evidencetrust.evidence;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.evidencetrust.Fixtures;
import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Severity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemporalConsistencyCheckerTest {
    private final TemporalConsistencyChecker checker = new TemporalConsistencyChecker(Duration.ofHours(24));

    @Test
    void shouldScoreOrderedLogsAsClean() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00Z", "2026-03-01T10:05:00Z", "2026-03-01T11:00:00Z")));

        assertEquals(100.0, result.score());
        assertTrue(result.findings().isEmpty());
    }

    @Test
    void shouldPenalizeEachDecreaseOnce() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00Z", "2026-03-01T09:00:00Z", "2026-03-01T10:30:00Z")));

        assertEquals(85.0, result.score());
        assertEquals(1, result.count(Severity.WARNING));
        String description = result.findings().get(0).description();
        assertTrue(description.contains("2026-03-01T09:00:00Z"), description);
        assertTrue(description.contains("2026-03-01T10:00:00Z"), description);
        assertTrue(description.contains("record 2"), description);
    }

    @Test
    void shouldFloorScoreAtZero() {
        String[] timestamps = new String[9];
        for (int i = 0; i < timestamps.length; i++) {
            timestamps[i] = "2026-03-01T" + String.format("%02d", 20 - i) + ":00:00Z";
        }
        CheckResult result = checker.check(List.of(Fixtures.log("reversed", timestamps)));

        assertEquals(8, result.count(Severity.WARNING));
        assertEquals(0.0, result.score());
    }

    @Test
    void shouldReportLongCollectionWindowAsInfo() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00Z", "2026-03-02T11:00:00Z"),
                Fixtures.log("b", "2026-03-01T10:00:00Z")));

        assertEquals(95.0, result.score());
        assertEquals(1, result.count(Severity.INFO));
    }

    @Test
    void shouldAccumulatePenaltiesAcrossLogs() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00Z", "2026-03-01T09:00:00Z"),
                Fixtures.log("b", "2026-03-01T10:00:00Z", "2026-03-01T09:59:00Z")));

        assertEquals(70.0, result.score());
        assertEquals(2, result.findings().size());
    }

    @Test
    void shouldReportUnparseableTimestampsWithoutPenalty() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00Z", "yesterday", "2026-03-01T10:10:00Z")));

        assertEquals(100.0, result.score());
        assertEquals(1, result.findings().size());
        assertEquals("TS-UNPARSEABLE-1", result.findings().get(0).id());
        assertEquals(Severity.INFO, result.findings().get(0).severity());
        assertTrue(result.findings().get(0).description().startsWith("1 of 3 records"));
    }

    @Test
    void shouldOrderZonelessAndDateOnlyTimestampsAsUtc() {
        CheckResult result = checker.check(List.of(
                Fixtures.log("a", "2026-03-01T10:00:00", "2026-03-01T09:30:00Z", "2026-03-01T10:15:00.250"),
                Fixtures.log("b", "2026-03-02", "2026-03-01T23:00:00")));

        assertEquals(70.0, result.score());
        assertEquals(2, result.count(Severity.WARNING));
        assertEquals(0, result.count(Severity.INFO));
    }
}
