package com.evidencetrust.governance;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.enhancement.EnhancementApplier;
import com.evidencetrust.enhancement.EnhancementResult;
import com.evidencetrust.enhancement.ExternalEvaluator;
import com.evidencetrust.evidence.EvidenceLogSource;
import com.evidencetrust.governance.document.DocumentReview;
import com.evidencetrust.governance.pipeline.PipelineReview;
import com.evidencetrust.input.DocumentBundle;
import com.evidencetrust.input.PipelineBundle;
import com.evidencetrust.input.ReviewInput;

/**
 * Produces a governance report for one review input: deterministic baseline, optional external
 * enhancement, aggregation and report assembly.
 *
 * <p>The engine holds no per-run state and may be shared across threads. An external evaluator
 * can only move adjustable dimensions within configured bounds; if it fails or times out the
 * deterministic baseline is reported unchanged.
 */
public class GovernanceEngine {
    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final GovernanceConfig config;
    private final ExternalEvaluator evaluator;
    private final Clock clock;
    private final PipelineReview pipelineReview;
    private final DocumentReview documentReview;
    private final ScoreAggregator aggregator;
    private final EnhancementApplier applier;
    private final ReportBuilder reportBuilder;

    public GovernanceEngine(GovernanceConfig config, EvidenceLogSource logSource) {
        this(config, logSource, null, Clock.systemUTC());
    }

    /**
     * @param evaluator external evaluator, or {@code null} when none is available
     */
    public GovernanceEngine(GovernanceConfig config, EvidenceLogSource logSource, ExternalEvaluator evaluator, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.evaluator = evaluator;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.documentReview = new DocumentReview(clock);
        this.pipelineReview = new PipelineReview(config, Objects.requireNonNull(logSource, "logSource"));
        this.aggregator = new ScoreAggregator(config);
        this.applier = new EnhancementApplier(config.adjustmentBounds(), config.findingRouter());
        this.reportBuilder = new ReportBuilder(clock, new ReportHasher());
    }

    public GovernanceReport review(ReviewInput input) {
        return review(input, EnhancementRequest.none());
    }

    public GovernanceReport review(ReviewInput input, EnhancementRequest request) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(request, "request");
        Instant startedAt = clock.instant();

        Map<Dimension, CheckResult> baseline = baseline(input);
        ScoreAggregator.Aggregation deterministic = aggregator.aggregate(aggregator.dimensions(baseline));
        log.debug("Deterministic baseline confidence={} tier={}", deterministic.confidenceScore(), deterministic.trustTier().label());

        Optional<EnhancementResult> enhancement = enhance(input, request);
        ScoreAggregator.Aggregation aggregation = enhancement
                .map(result -> aggregator.aggregate(aggregator.dimensions(applier.apply(baseline, result))))
                .orElse(deterministic);
        String narrative = enhancement.map(EnhancementResult::narrative).orElse(null);

        GovernanceReport report = reportBuilder.build(aggregation, narrative, request.evaluatorName(), startedAt);
        log.info("Governance review {} confidence={} tier={} findings={} model={}",
                report.id(),
                report.confidenceScore(),
                report.trustTier().label(),
                report.totalFindings(),
                report.modelUsed());
        return report;
    }

    private Map<Dimension, CheckResult> baseline(ReviewInput input) {
        if (input instanceof PipelineBundle pipeline) {
            return pipelineReview.evaluate(pipeline);
        }
        if (input instanceof DocumentBundle document) {
            return documentReview.evaluate(document);
        }
        throw new IllegalArgumentException("Unsupported review input: " + input.getClass().getName());
    }

    private Optional<EnhancementResult> enhance(ReviewInput input, EnhancementRequest request) {
        if (!request.engaged()) {
            return Optional.empty();
        }
        if (evaluator == null) {
            log.warn("Evaluator '{}' requested but none is available; keeping deterministic baseline", request.evaluatorName());
            return Optional.empty();
        }

        Duration timeout = request.timeout() == null ? config.enhancementTimeout() : request.timeout();
        CompletableFuture<EnhancementResult> future;
        try {
            future = evaluator.evaluate(input);
        } catch (RuntimeException e) {
            log.warn("Evaluator '{}' could not start: {}", request.evaluatorName(), e.getMessage());
            return Optional.empty();
        }

        try {
            return Optional.ofNullable(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Evaluator '{}' timed out after {} ms; keeping deterministic baseline", request.evaluatorName(), timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for evaluator '{}'; keeping deterministic baseline", request.evaluatorName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Evaluator '{}' failed: {}; keeping deterministic baseline", request.evaluatorName(), cause.getMessage());
        } catch (CancellationException e) {
            log.warn("Evaluator '{}' was cancelled; keeping deterministic baseline", request.evaluatorName());
        }
        return Optional.empty();
    }
}
