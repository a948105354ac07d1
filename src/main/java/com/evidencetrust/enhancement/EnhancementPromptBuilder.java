package com.evidencetrust.enhancement;

import java.util.Locale;

import com.evidencetrust.input.Control;
import com.evidencetrust.input.ControlStatus;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.PipelineBundle;
import com.evidencetrust.input.ProbeResult;
import com.evidencetrust.input.ReviewInput;

/**
 * Renders the review prompt sent to an external evaluator. Only summary counts are included,
 * never raw evidence.
 */
public class EnhancementPromptBuilder {
    private final AdjustmentBounds bounds;

    public EnhancementPromptBuilder(AdjustmentBounds bounds) {
        this.bounds = bounds;
    }

    public String build(ReviewInput input) {
        String summary;
        if (input instanceof PipelineBundle pipeline) {
            summary = pipelineSummary(pipeline);
        } else if (input instanceof DocumentBundle document) {
            summary = documentSummary(document);
        } else {
            throw new IllegalArgumentException("Unsupported review input: " + input.getClass().getName());
        }

        String range = "(" + format(bounds.min()) + " to +" + format(bounds.max()) + ")";
        return "You are an adversarial governance reviewer for a compliance assessment.\n\n"
                + "Review the following assessment artifacts and identify issues with:\n"
                + "1. METHODOLOGY: Is the approach systematic? Was the evidence gathered appropriately?\n"
                + "2. COMPLETENESS: Was everything in scope covered? Any gaps?\n"
                + "3. BIAS: Are findings balanced? Is severity appropriate? Any cherry-picking?\n\n"
                + "Assessment Summary:\n"
                + summary
                + "\nRespond in JSON (no markdown, no explanation outside JSON):\n"
                + "{\n"
                + "  \"methodology_adjustment\": number " + range + ",\n"
                + "  \"completeness_adjustment\": number " + range + ",\n"
                + "  \"bias_adjustment\": number " + range + ",\n"
                + "  \"findings\": [{\"severity\": \"critical\"|\"warning\"|\"info\", \"category\": "
                + "\"methodology\"|\"completeness\"|\"bias_detection\", \"description\": string, \"remediation\": string}],\n"
                + "  \"narrative\": string (2-3 sentence executive summary)\n"
                + "}";
    }

    private static String pipelineSummary(PipelineBundle bundle) {
        long succeeded = bundle.probeResults().stream().filter(ProbeResult::succeeded).count();
        long blocked = bundle.probeResults().size() - succeeded;
        String threatModel = bundle.threatModel() == null
                ? "No threat model provided"
                : bundle.threatModel().methodology() + " analysis: " + bundle.threatModel().threatCount()
                        + " threats identified across " + bundle.threatModel().provider();
        String criteria = bundle.criteria().isEmpty()
                ? "No acceptance criteria defined"
                : bundle.criteria().size() + " acceptance criteria defined";
        return "- Providers tested: " + String.join(", ", bundle.scope().providers()) + "\n"
                + "- Resources in scope: " + bundle.scope().resourceCount() + "\n"
                + "- Drift results: " + bundle.driftFindings().size() + " findings across "
                + bundle.driftResults().size() + " checks\n"
                + "- Probe results: " + bundle.probeResults().size() + " attack simulations (" + succeeded
                + " succeeded, " + blocked + " blocked)\n"
                + "- Framework mappings: " + bundle.mappingResults().size() + "\n"
                + "- Evidence logs: " + bundle.evidenceLogs().size() + "\n"
                + "- Threat model: " + threatModel + "\n"
                + "- Criteria: " + criteria + "\n";
    }

    private static String documentSummary(DocumentBundle bundle) {
        long effective = bundle.controls().stream().filter(c -> c.status() == ControlStatus.EFFECTIVE).count();
        long ineffective = bundle.controls().stream().filter(c -> c.status() == ControlStatus.INEFFECTIVE).count();
        long withEvidence = bundle.controls().stream().filter(Control::hasEvidence).count();
        DocumentBundle.DocumentMetadata metadata = bundle.metadata();
        DocumentBundle.AssessmentContext context = bundle.assessmentContext();
        return "- Document source: " + bundle.source().label() + "\n"
                + "- Title: " + orUnknown(metadata.title()) + "\n"
                + "- Issuer: " + orUnknown(metadata.issuer()) + "\n"
                + "- Auditor: " + orUnknown(metadata.auditor()) + "\n"
                + "- Scope: " + orUnknown(metadata.scope()) + "\n"
                + "- Controls: " + bundle.controls().size() + " (" + effective + " effective, " + ineffective
                + " ineffective, " + withEvidence + " with evidence)\n"
                + "- Declared gaps: " + (context == null ? 0 : context.gaps().size()) + "\n"
                + "- Tech stack entries: " + (context == null ? 0 : context.techStack().size()) + "\n";
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
