package com.evidencetrust.input;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentBundle(
        DocumentSource source,
        List<Control> controls,
        DocumentMetadata metadata,
        AssessmentContext assessmentContext) implements ReviewInput {

    public DocumentBundle {
        Objects.requireNonNull(source, "source");
        controls = controls == null ? List.of() : List.copyOf(controls);
        metadata = metadata == null ? new DocumentMetadata(null, null, null, null, null, null, null) : metadata;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocumentMetadata(
            String title,
            String issuer,
            String date,
            String scope,
            String auditor,
            String reportType,
            StructuralSections structuralSections) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StructuralSections(
            boolean auditorReport,
            boolean managementAssertion,
            boolean systemDescription,
            boolean controlMatrix,
            boolean testResults) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AssessmentContext(
            List<TechStackEntry> techStack,
            List<String> gaps,
            String scopeCoverage,
            String assessorNotes) {

        public AssessmentContext {
            techStack = techStack == null ? List.of() : List.copyOf(techStack);
            gaps = gaps == null ? List.of() : List.copyOf(gaps);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TechStackEntry(String component, String technology, String scope) {
    }
}
