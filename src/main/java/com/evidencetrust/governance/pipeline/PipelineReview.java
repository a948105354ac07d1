package com.evidencetrust.governance.pipeline;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.evidence.CorrelationChecker;
import com.evidencetrust.evidence.EvidenceLog;
import com.evidencetrust.evidence.EvidenceLogSource;
import com.evidencetrust.evidence.IntegrityVerifier;
import com.evidencetrust.evidence.TemporalConsistencyChecker;
import com.evidencetrust.governance.CheckResult;
import com.evidencetrust.governance.Dimension;
import com.evidencetrust.governance.Finding;
import com.evidencetrust.governance.GovernanceConfig;
import com.evidencetrust.input.PipelineBundle;

/**
 * Deterministic baseline for a pipeline bundle. Every named evidence log is opened exactly once
 * and shared read-only by the integrity, temporal and correlation checks.
 */
public class PipelineReview {
    private static final Logger log = LoggerFactory.getLogger(PipelineReview.class);

    private final EvidenceLogSource logSource;
    private final IntegrityVerifier integrityVerifier = new IntegrityVerifier();
    private final TemporalConsistencyChecker temporalChecker;
    private final CorrelationChecker correlationChecker;
    private final PipelineMethodologyScorer methodologyScorer = new PipelineMethodologyScorer();
    private final PipelineBiasScorer biasScorer;

    public PipelineReview(GovernanceConfig config, EvidenceLogSource logSource) {
        this.logSource = logSource;
        this.temporalChecker = new TemporalConsistencyChecker(config.evidence().collectionWindow());
        this.correlationChecker = new CorrelationChecker(config.evidence().correlationField());
        this.biasScorer = new PipelineBiasScorer(config.bias());
    }

    public Map<Dimension, CheckResult> evaluate(PipelineBundle bundle) {
        List<EvidenceLog> logs = bundle.evidenceLogs().stream().map(logSource::open).toList();
        log.debug("Loaded {} evidence log(s) with {} record(s)",
                logs.size(),
                logs.stream().mapToInt(l -> l.records().size()).sum());

        CheckResult integrity = integrityVerifier.check(logs);
        CheckResult temporal = temporalChecker.check(logs);
        CheckResult correlation = correlationChecker.check(logs, bundle.probeResults());

        Map<Dimension, CheckResult> results = new EnumMap<>(Dimension.class);
        results.put(Dimension.METHODOLOGY, methodologyScorer.score(bundle));
        results.put(Dimension.EVIDENCE_INTEGRITY, integrity);
        results.put(Dimension.COMPLETENESS, completeness(temporal, correlation));
        results.put(Dimension.BIAS_DETECTION, biasScorer.score(bundle));
        return results;
    }

    static CheckResult completeness(CheckResult temporal, CheckResult correlation) {
        List<Finding> findings = new ArrayList<>(temporal.findings());
        findings.addAll(correlation.findings());
        return CheckResult.of(Math.round((temporal.score() + correlation.score()) / 2.0), findings);
    }
}
