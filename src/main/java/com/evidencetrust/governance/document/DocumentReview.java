package com.evidencetrust.governance.document;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Dimension;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.Severity;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.EvidenceMethod;

/**
 * Deterministic baseline for a single evidence document. The four dimension scorers run first;
 * supplementary checks are then folded into methodology, evidence integrity and completeness by fixed rules.
 */
public class DocumentReview {
    private static final Logger log = LoggerFactory.getLogger(DocumentReview.class);

    static final int AUDITOR_WARNING_DELTA = -15;
    static final int AUDITOR_INFO_DELTA = 5;
    static final int INVENTORY_WARNING_DELTA = -10;
    static final int INVENTORY_INFO_DELTA = -5;
    static final int DISCONNECTED_DELTA = -10;
    static final int MISSING_SECTION_DELTA = -5;
    static final int CONSISTENCY_DELTA = -10;
    static final int SEVERITY_MISMATCH_DELTA = -5;
    static final int STALE_DELTA = -5;
    static final int UNMAPPED_DELTA = 0;

    private final EvidenceClassifier classifier = new EvidenceClassifier();
    private final BoilerplateDetector boilerplateDetector = new BoilerplateDetector();
    private final DocumentMethodologyScorer methodologyScorer = new DocumentMethodologyScorer();
    private final DocumentEvidenceIntegrityScorer integrityScorer = new DocumentEvidenceIntegrityScorer();
    private final DocumentCompletenessScorer completenessScorer = new DocumentCompletenessScorer();
    private final DocumentBiasScorer biasScorer = new DocumentBiasScorer();
    private final AuditorLegitimacyCheck auditorCheck = new AuditorLegitimacyCheck();
    private final SystemDescriptionCheck systemDescriptionCheck = new SystemDescriptionCheck();
    private final StructuralCompletenessCheck structuralCheck = new StructuralCompletenessCheck();
    private final ConsistencyCheck consistencyCheck = new ConsistencyCheck();
    private final SeverityMismatchCheck severityMismatchCheck = new SeverityMismatchCheck();
    private final FrameworkCoverageCheck frameworkCoverageCheck = new FrameworkCoverageCheck();
    private final RecencyCheck recencyCheck;

    public DocumentReview(Clock clock) {
        this.recencyCheck = new RecencyCheck(clock);
    }

    public Map<Dimension, CheckResult> evaluate(DocumentBundle bundle) {
        List<EvidenceMethod> methods = bundle.controls().stream().map(classifier::classify).toList();
        Map<String, List<String>> boilerplate = boilerplateDetector.detect(bundle.controls());
        log.debug("Classified {} control(s) from {} document, {} flagged as boilerplate",
                methods.size(), bundle.source().label(), boilerplate.size());

        Accumulator methodology = new Accumulator(methodologyScorer.score(bundle, methods));
        Accumulator integrity = new Accumulator(integrityScorer.score(bundle, boilerplate));
        Accumulator completeness = new Accumulator(completenessScorer.score(bundle));
        CheckResult bias = biasScorer.score(bundle);

        auditorCheck.check(bundle.metadata()).ifPresent(finding -> methodology.add(finding,
                finding.severity() == Severity.WARNING ? AUDITOR_WARNING_DELTA : AUDITOR_INFO_DELTA));

        SystemDescriptionCheck.Outcome description = systemDescriptionCheck.check(bundle);
        for (Finding finding : description.methodologyFindings()) {
            methodology.add(finding,
                    finding.severity() == Severity.WARNING ? INVENTORY_WARNING_DELTA : INVENTORY_INFO_DELTA);
        }
        for (Finding finding : description.integrityFindings()) {
            integrity.add(finding, DISCONNECTED_DELTA);
        }

        for (Finding finding : structuralCheck.check(bundle)) {
            methodology.add(finding, MISSING_SECTION_DELTA);
        }

        for (Finding finding : consistencyCheck.check(bundle)) {
            integrity.add(finding, CONSISTENCY_DELTA);
        }
        severityMismatchCheck.check(bundle).ifPresent(finding -> methodology.add(finding, SEVERITY_MISMATCH_DELTA));
        recencyCheck.check(bundle).ifPresent(finding -> methodology.add(finding, STALE_DELTA));
        frameworkCoverageCheck.check(bundle).ifPresent(finding -> completeness.add(finding, UNMAPPED_DELTA));

        Map<Dimension, CheckResult> results = new EnumMap<>(Dimension.class);
        results.put(Dimension.METHODOLOGY, methodology.result());
        results.put(Dimension.EVIDENCE_INTEGRITY, integrity.result());
        results.put(Dimension.COMPLETENESS, completeness.result());
        results.put(Dimension.BIAS_DETECTION, bias);
        return results;
    }

    private static final class Accumulator {
        private double score;
        private final List<Finding> findings;

        Accumulator(CheckResult base) {
            this.score = base.score();
            this.findings = new ArrayList<>(base.findings());
        }

        void add(Finding finding, int delta) {
            findings.add(finding);
            score += delta;
        }

        CheckResult result() {
            return CheckResult.of(score, findings);
        }
    }
}
