package com.evidencetrust.governance;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import com.evidencetrust.enhancement.AdjustmentBounds;
import com.evidencetrust.enhancement.FindingRouter;

/**
 * Immutable configuration handed to the engine at construction. Weights are fixed for the
 * lifetime of the engine and therefore for every run it performs.
 */
public record GovernanceConfig(
        Map<Dimension, Double> weights,
        TrustThresholds thresholds,
        EvidencePolicy evidence,
        BiasPolicy bias,
        AdjustmentBounds adjustmentBounds,
        FindingRouter findingRouter,
        Duration enhancementTimeout) {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    public GovernanceConfig {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(evidence, "evidence");
        Objects.requireNonNull(bias, "bias");
        Objects.requireNonNull(adjustmentBounds, "adjustmentBounds");
        Objects.requireNonNull(findingRouter, "findingRouter");
        Objects.requireNonNull(enhancementTimeout, "enhancementTimeout");

        EnumMap<Dimension, Double> copy = new EnumMap<>(Dimension.class);
        double sum = 0.0;
        for (Dimension dimension : Dimension.values()) {
            Double weight = weights.get(dimension);
            if (weight == null || weight <= 0.0 || weight > 1.0) {
                throw new IllegalArgumentException("weight for " + dimension.key() + " must be in (0, 1], got " + weight);
            }
            copy.put(dimension, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(String.format("dimension weights must sum to 1.0 (actual=%.4f)", sum));
        }
        if (enhancementTimeout.isNegative() || enhancementTimeout.isZero()) {
            throw new IllegalArgumentException("enhancementTimeout must be positive");
        }
        weights = Collections.unmodifiableMap(copy);
    }

    public static GovernanceConfig defaults() {
        return new GovernanceConfig(
                defaultWeights(),
                TrustThresholds.defaults(),
                EvidencePolicy.defaults(),
                BiasPolicy.defaults(),
                AdjustmentBounds.defaults(),
                FindingRouter.defaults(),
                Duration.ofSeconds(30));
    }

    public static Map<Dimension, Double> defaultWeights() {
        EnumMap<Dimension, Double> weights = new EnumMap<>(Dimension.class);
        weights.put(Dimension.METHODOLOGY, 0.30);
        weights.put(Dimension.EVIDENCE_INTEGRITY, 0.25);
        weights.put(Dimension.COMPLETENESS, 0.25);
        weights.put(Dimension.BIAS_DETECTION, 0.20);
        return weights;
    }

    public double weight(Dimension dimension) {
        return weights.get(dimension);
    }

    public GovernanceConfig withWeights(Map<Dimension, Double> newWeights) {
        return new GovernanceConfig(newWeights, thresholds, evidence, bias, adjustmentBounds, findingRouter, enhancementTimeout);
    }

    public GovernanceConfig withEnhancementTimeout(Duration timeout) {
        return new GovernanceConfig(weights, thresholds, evidence, bias, adjustmentBounds, findingRouter, timeout);
    }

    public record TrustThresholds(int aiVerified, int auditorVerified) {
        public TrustThresholds {
            if (aiVerified < 0 || auditorVerified > 100 || aiVerified > auditorVerified) {
                throw new IllegalArgumentException(
                        "trust thresholds must satisfy 0 <= aiVerified <= auditorVerified <= 100 (aiVerified="
                                + aiVerified + ", auditorVerified=" + auditorVerified + ")");
            }
        }

        public static TrustThresholds defaults() {
            return new TrustThresholds(70, 90);
        }
    }

    /**
     * @param correlationField payload field holding the probe identifier in evidence records
     * @param collectionWindow span between first and last record above which a gap is reported
     */
    public record EvidencePolicy(String correlationField, Duration collectionWindow) {
        public EvidencePolicy {
            if (correlationField == null || correlationField.isBlank()) {
                throw new IllegalArgumentException("correlationField must not be blank");
            }
            Objects.requireNonNull(collectionWindow, "collectionWindow");
        }

        public static EvidencePolicy defaults() {
            return new EvidencePolicy("probeId", Duration.ofHours(24));
        }
    }

    public record BiasPolicy(
            int minProbeSample,
            int allBlockedPenalty,
            int allSucceededPenalty,
            int minDriftFindings,
            int uniformSeverityPenalty) {

        public static BiasPolicy defaults() {
            return new BiasPolicy(3, 10, 20, 3, 5);
        }
    }
}
