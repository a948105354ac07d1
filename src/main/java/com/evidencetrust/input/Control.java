package com.evidencetrust.input;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A normalized control from an ingested document. {@code method} and {@code boilerplateFlags}
 * are optional classifications from the ingestion collaborator. {@code sourceTool} names the tool
 * that assessed the control when a document merges several tools' results; otherwise the
 * document's own source applies.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Control(
        String id,
        String description,
        ControlStatus status,
        RiskLevel severity,
        String evidence,
        EvidenceMethod method,
        List<String> boilerplateFlags,
        @JsonAlias("frameworks") List<String> frameworkRefs,
        String sourceTool) {

    public Control {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("control id must not be blank");
        }
        status = status == null ? ControlStatus.NOT_TESTED : status;
        boilerplateFlags = boilerplateFlags == null
                ? List.of()
                : boilerplateFlags.stream().filter(Objects::nonNull).toList();
        frameworkRefs = frameworkRefs == null
                ? List.of()
                : frameworkRefs.stream().filter(ref -> ref != null && !ref.isBlank()).map(String::trim).distinct().toList();
    }

    public static Control of(String id, ControlStatus status, String evidence) {
        return new Control(id, "", status, null, evidence, null, List.of(), List.of(), null);
    }

    public boolean hasEvidence() {
        return evidence != null && !evidence.isBlank();
    }

    public String toolOr(DocumentSource documentSource) {
        return sourceTool == null || sourceTool.isBlank() ? documentSource.label() : sourceTool.trim();
    }
}
