package com.evidencetrust.enhancement;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class ExternalEvaluators {
    private static final Logger log = LoggerFactory.getLogger(ExternalEvaluators.class);

    private ExternalEvaluators() {
    }

    /**
     * @return an HTTP evaluator for the named model, or empty when no endpoint is configured
     */
    public static Optional<ExternalEvaluator> fromConfig(
            AppConfig.EnhancementConfig config,
            String evaluatorName,
            AdjustmentBounds bounds,
            OkHttpClient httpClient) {
        String endpoint = config.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            log.warn("No evaluator endpoint configured; external enhancement for '{}' is unavailable", evaluatorName);
            return Optional.empty();
        }
        String apiKey = config.getApiKeyEnv() == null ? null : System.getenv(config.getApiKeyEnv());
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Environment variable {} is not set; evaluator requests will be unauthenticated", config.getApiKeyEnv());
        }
        return Optional.of(new HttpExternalEvaluator(httpClient, endpoint, evaluatorName, apiKey, config.getMaxTokens(), bounds));
    }
}
