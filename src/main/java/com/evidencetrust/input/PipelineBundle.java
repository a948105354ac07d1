package com.evidencetrust.input;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Artifacts of an earlier assessment pipeline. {@code threatModel} and {@code criteria} are
 * optional; an empty criteria list counts as absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineBundle(
        List<String> evidenceLogs,
        List<DriftResult> driftResults,
        List<ProbeResult> probeResults,
        List<MappingResult> mappingResults,
        ThreatModel threatModel,
        List<Criterion> criteria,
        Scope scope) implements ReviewInput {

    public PipelineBundle {
        evidenceLogs = evidenceLogs == null ? List.of() : List.copyOf(evidenceLogs);
        driftResults = driftResults == null ? List.of() : List.copyOf(driftResults);
        probeResults = probeResults == null ? List.of() : List.copyOf(probeResults);
        mappingResults = mappingResults == null ? List.of() : List.copyOf(mappingResults);
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        scope = scope == null ? new Scope(List.of(), 0) : scope;
    }

    public List<DriftFinding> driftFindings() {
        return driftResults.stream().flatMap(result -> result.findings().stream()).toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DriftResult(String checkId, List<DriftFinding> findings) {
        public DriftResult {
            findings = findings == null ? List.of() : List.copyOf(findings);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DriftFinding(String id, RiskLevel severity, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MappingResult(String framework, String controlId, String status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreatModel(String methodology, String provider, int threatCount) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Criterion(String id, String text, String satisfaction) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scope(List<String> providers, int resourceCount) {
        public Scope {
            providers = providers == null ? List.of() : List.copyOf(providers);
        }
    }
}
