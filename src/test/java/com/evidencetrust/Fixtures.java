package com.evidencetrust;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import com.evidencetrust.evidence.EvidenceChainBuilder;
import com.evidencetrust.evidence.EvidenceLog;
import com.evidencetrust.evidence.EvidenceRecord;
import com.evidencetrust.evidence.JsonlEvidenceLog;
import com.evidencetrust.input.PipelineBundle;
import com.evidencetrust.input.ProbeResult;
import com.evidencetrust.input.RiskLevel;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class Fixtures {
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private Fixtures() {
    }

    public static ObjectNode probeData(String probeId) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("probeId", probeId);
        data.put("result", "recorded");
        return data;
    }

    /**
     * Valid chain with one record per timestamp, each citing probe "P&lt;n&gt;".
     */
    public static List<EvidenceRecord> chain(String... timestamps) {
        EvidenceChainBuilder builder = new EvidenceChainBuilder();
        for (int i = 0; i < timestamps.length; i++) {
            builder.append(timestamps[i], "probe", probeData("P" + (i + 1)));
        }
        return builder.records();
    }

    public static EvidenceLog log(String name, String... timestamps) {
        return EvidenceLog.of(name, chain(timestamps));
    }

    public static void writeLog(Path file, List<EvidenceRecord> records) throws IOException {
        JsonlEvidenceLog writer = new JsonlEvidenceLog(file.getParent());
        for (EvidenceRecord record : records) {
            writer.append(file, record);
        }
    }

    public static List<ProbeResult> probes(boolean... succeeded) {
        List<ProbeResult> probes = new ArrayList<>();
        for (int i = 0; i < succeeded.length; i++) {
            probes.add(new ProbeResult("P" + (i + 1), "target-" + (i + 1), "vector", succeeded[i]));
        }
        return probes;
    }

    /**
     * A pipeline bundle with every upstream phase present and a mixed outcome distribution.
     */
    public static PipelineBundle completePipeline(List<String> evidenceLogs, List<ProbeResult> probes) {
        return new PipelineBundle(
                evidenceLogs,
                List.of(new PipelineBundle.DriftResult("drift-1", List.of(
                        new PipelineBundle.DriftFinding("D1", RiskLevel.HIGH, "MFA disabled"),
                        new PipelineBundle.DriftFinding("D2", RiskLevel.MEDIUM, "Password policy weak"),
                        new PipelineBundle.DriftFinding("D3", RiskLevel.LOW, "Session timeout long")))),
                probes,
                List.of(new PipelineBundle.MappingResult("SOC2", "CC6.1", "mapped")),
                new PipelineBundle.ThreatModel("STRIDE", "aws", 7),
                List.of(new PipelineBundle.Criterion("C1", "MFA enforced for all users", "satisfied")),
                new PipelineBundle.Scope(List.of("aws"), 12));
    }
}
