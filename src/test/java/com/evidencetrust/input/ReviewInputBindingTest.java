package com.evidencetrust.input;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviewInputBindingTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldBindPipelineBundleWithAliasesAndDefaults() throws IOException {
        PipelineBundle bundle = mapper.readValue("""
                {
                  "evidenceLogs": ["run.jsonl"],
                  "driftResults": [{"checkId": "d", "findings": [{"id": "D1", "severity": "HIGH", "description": "x"}]}],
                  "probeResults": [{"probeId": "P1", "target": "t", "vector": "v", "success": true}],
                  "extra": "ignored"
                }
                """, PipelineBundle.class);

        assertTrue(bundle.probeResults().get(0).succeeded());
        assertEquals(RiskLevel.HIGH, bundle.driftFindings().get(0).severity());
        assertTrue(bundle.criteria().isEmpty());
        assertNull(bundle.threatModel());
        assertEquals(0, bundle.scope().resourceCount());
    }

    @Test
    void shouldMapControlStatusLabels() {
        assertEquals(ControlStatus.EFFECTIVE, ControlStatus.fromLabel("Compliant"));
        assertEquals(ControlStatus.INEFFECTIVE, ControlStatus.fromLabel("partially_compliant"));
        assertEquals(ControlStatus.INEFFECTIVE, ControlStatus.fromLabel("non-compliant"));
        assertEquals(ControlStatus.NOT_TESTED, ControlStatus.fromLabel(null));
        assertThrows(IllegalArgumentException.class, () -> ControlStatus.fromLabel("maybe"));
    }

    @Test
    void shouldBindDocumentBundle() throws IOException {
        DocumentBundle bundle = mapper.readValue("""
                {
                  "source": "soc2",
                  "controls": [{"id": "CC6.1", "status": "effective", "evidence": "Inspected IAM policy"}],
                  "metadata": {"auditor": "Schellman & Company, LLC"}
                }
                """, DocumentBundle.class);

        assertEquals(DocumentSource.SOC2, bundle.source());
        assertEquals(ControlStatus.EFFECTIVE, bundle.controls().get(0).status());
        assertTrue(bundle.controls().get(0).boilerplateFlags().isEmpty());
        assertNull(bundle.assessmentContext());
        assertNull(bundle.metadata().structuralSections());
    }

    @Test
    void shouldRejectControlWithoutId() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue("""
                {
                  "source": "soc2",
                  "controls": [{"id": "CC6.1", "status": "effective"}, {"status": "ineffective", "evidence": "x"}]
                }
                """, DocumentBundle.class));
        assertThrows(JsonMappingException.class, () -> mapper.readValue("""
                {"source": "soc2", "controls": [{"id": null, "status": "effective"}]}
                """, DocumentBundle.class));
    }

    @Test
    void shouldBindFrameworkMappingAndSourceTool() throws IOException {
        DocumentBundle bundle = mapper.readValue("""
                {
                  "source": "json",
                  "controls": [{"id": "iam_mfa", "status": "pass", "frameworks": ["SOC2:CC6.1"], "sourceTool": "prowler"}]
                }
                """, DocumentBundle.class);

        Control control = bundle.controls().get(0);
        assertEquals(List.of("SOC2:CC6.1"), control.frameworkRefs());
        assertEquals("prowler", control.toolOr(bundle.source()));
    }
}
