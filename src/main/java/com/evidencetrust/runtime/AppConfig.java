package com.evidencetrust.runtime;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.evidencetrust.enhancement.AdjustmentBounds;
import com.evidencetrust.enhancement.ExternalCategory;
import com.evidencetrust.enhancement.FindingRouter;
import com.evidencetrust.governance.Dimension;
import com.evidencetrust.governance.GovernanceConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ScoringConfig scoring = new ScoringConfig();
    private EvidenceConfig evidence = new EvidenceConfig();
    private BiasConfig bias = new BiasConfig();
    private EnhancementConfig enhancement = new EnhancementConfig();

    public ScoringConfig getScoring() {
        return scoring;
    }

    public void setScoring(ScoringConfig scoring) {
        this.scoring = scoring == null ? new ScoringConfig() : scoring;
    }

    public EvidenceConfig getEvidence() {
        return evidence;
    }

    public void setEvidence(EvidenceConfig evidence) {
        this.evidence = evidence == null ? new EvidenceConfig() : evidence;
    }

    public BiasConfig getBias() {
        return bias;
    }

    public void setBias(BiasConfig bias) {
        this.bias = bias == null ? new BiasConfig() : bias;
    }

    public EnhancementConfig getEnhancement() {
        return enhancement;
    }

    public void setEnhancement(EnhancementConfig enhancement) {
        this.enhancement = enhancement == null ? new EnhancementConfig() : enhancement;
    }

    /**
     * @throws IllegalArgumentException when the configured values do not form a valid configuration
     */
    public GovernanceConfig toGovernanceConfig() {
        Map<Dimension, Double> weights = new EnumMap<>(Dimension.class);
        scoring.getWeights().forEach((key, value) -> weights.put(Dimension.fromKey(key), value));

        FindingRouter router = FindingRouter.defaults();
        if (!enhancement.getRouting().isEmpty()) {
            Map<ExternalCategory, Dimension> routes = new EnumMap<>(router.routes());
            enhancement.getRouting().forEach((category, dimension) -> routes.put(
                    ExternalCategory.parse(category)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown external category: " + category)),
                    Dimension.fromKey(dimension)));
            router = new FindingRouter(routes);
        }

        return new GovernanceConfig(
                weights,
                new GovernanceConfig.TrustThresholds(scoring.getAiVerifiedThreshold(), scoring.getAuditorVerifiedThreshold()),
                new GovernanceConfig.EvidencePolicy(
                        evidence.getCorrelationField(),
                        Duration.ofHours(evidence.getCollectionWindowHours())),
                new GovernanceConfig.BiasPolicy(
                        bias.getMinProbeSample(),
                        bias.getAllBlockedPenalty(),
                        bias.getAllSucceededPenalty(),
                        bias.getMinDriftFindings(),
                        bias.getUniformSeverityPenalty()),
                new AdjustmentBounds(enhancement.getMinAdjustment(), enhancement.getMaxAdjustment()),
                router,
                Duration.ofMillis(enhancement.getTimeoutMs()));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScoringConfig {
        private Map<String, Double> weights = defaultWeights();
        private int aiVerifiedThreshold = 70;
        private int auditorVerifiedThreshold = 90;

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            GovernanceConfig.defaultWeights().forEach((dimension, weight) -> weights.put(dimension.key(), weight));
            return weights;
        }

        public Map<String, Double> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Double> weights) {
            this.weights = weights == null ? defaultWeights() : weights;
        }

        public int getAiVerifiedThreshold() {
            return aiVerifiedThreshold;
        }

        public void setAiVerifiedThreshold(int aiVerifiedThreshold) {
            this.aiVerifiedThreshold = aiVerifiedThreshold;
        }

        public int getAuditorVerifiedThreshold() {
            return auditorVerifiedThreshold;
        }

        public void setAuditorVerifiedThreshold(int auditorVerifiedThreshold) {
            this.auditorVerifiedThreshold = auditorVerifiedThreshold;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvidenceConfig {
        private String directory = ".";
        private String correlationField = "probeId";
        private long collectionWindowHours = 24;

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getCorrelationField() {
            return correlationField;
        }

        public void setCorrelationField(String correlationField) {
            this.correlationField = correlationField;
        }

        public long getCollectionWindowHours() {
            return collectionWindowHours;
        }

        public void setCollectionWindowHours(long collectionWindowHours) {
            this.collectionWindowHours = collectionWindowHours;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BiasConfig {
        private int minProbeSample = 3;
        private int allBlockedPenalty = 10;
        private int allSucceededPenalty = 20;
        private int minDriftFindings = 3;
        private int uniformSeverityPenalty = 5;

        public int getMinProbeSample() {
            return minProbeSample;
        }

        public void setMinProbeSample(int minProbeSample) {
            this.minProbeSample = minProbeSample;
        }

        public int getAllBlockedPenalty() {
            return allBlockedPenalty;
        }

        public void setAllBlockedPenalty(int allBlockedPenalty) {
            this.allBlockedPenalty = allBlockedPenalty;
        }

        public int getAllSucceededPenalty() {
            return allSucceededPenalty;
        }

        public void setAllSucceededPenalty(int allSucceededPenalty) {
            this.allSucceededPenalty = allSucceededPenalty;
        }

        public int getMinDriftFindings() {
            return minDriftFindings;
        }

        public void setMinDriftFindings(int minDriftFindings) {
            this.minDriftFindings = minDriftFindings;
        }

        public int getUniformSeverityPenalty() {
            return uniformSeverityPenalty;
        }

        public void setUniformSeverityPenalty(int uniformSeverityPenalty) {
            this.uniformSeverityPenalty = uniformSeverityPenalty;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnhancementConfig {
        private String evaluator = "deterministic";
        private String endpoint = "https://api.anthropic.com/v1/messages";
        private String apiKeyEnv = "EVIDENCE_TRUST_EVALUATOR_API_KEY";
        private int timeoutMs = 30000;
        private int maxTokens = 4096;
        private double minAdjustment = -20.0;
        private double maxAdjustment = 10.0;
        private Map<String, String> routing = new LinkedHashMap<>();

        public String getEvaluator() {
            return evaluator;
        }

        public void setEvaluator(String evaluator) {
            this.evaluator = evaluator;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getMinAdjustment() {
            return minAdjustment;
        }

        public void setMinAdjustment(double minAdjustment) {
            this.minAdjustment = minAdjustment;
        }

        public double getMaxAdjustment() {
            return maxAdjustment;
        }

        public void setMaxAdjustment(double maxAdjustment) {
            this.maxAdjustment = maxAdjustment;
        }

        public Map<String, String> getRouting() {
            return routing;
        }

        public void setRouting(Map<String, String> routing) {
            this.routing = routing == null ? new LinkedHashMap<>() : routing;
        }
    }
}
