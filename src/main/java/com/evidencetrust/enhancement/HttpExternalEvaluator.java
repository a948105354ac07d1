package com.evidencetrust.enhancement;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.evidencetrust.input.ReviewInput;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Evaluator backed by a Messages-style HTTP endpoint. One request per evaluation, no retries.
 */
public class HttpExternalEvaluator implements ExternalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(HttpExternalEvaluator.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    static final String API_VERSION = "2023-06-01";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int maxTokens;
    private final EnhancementPromptBuilder promptBuilder;
    private final EvaluatorResponseParser parser;

    public HttpExternalEvaluator(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int maxTokens,
            AdjustmentBounds bounds) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.maxTokens = maxTokens;
        this.promptBuilder = new EnhancementPromptBuilder(bounds);
        this.parser = new EvaluatorResponseParser(mapper);
    }

    @Override
    public CompletableFuture<EnhancementResult> evaluate(ReviewInput input) {
        CompletableFuture<EnhancementResult> future = new CompletableFuture<>();
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of(
                    "model", model,
                    "max_tokens", maxTokens,
                    "messages", List.of(Map.of("role", "user", "content", promptBuilder.build(input)))));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .header("anthropic-version", API_VERSION)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("x-api-key", apiKey);
            }
            request = requestBuilder.build();
        } catch (IOException | IllegalArgumentException e) {
            future.completeExceptionally(new EnhancementException("Could not build evaluator request", e));
            return future;
        }

        Call call = httpClient.newCall(request);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        log.debug("Requesting external evaluation from {} with model {}", endpoint, model);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                future.completeExceptionally(new EnhancementException("Evaluator call failed: " + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    future.complete(parser.parse(responseText(response)));
                } catch (IOException e) {
                    future.completeExceptionally(new EnhancementException("Could not read evaluator response", e));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private String responseText(Response response) throws IOException {
        ResponseBody body = response.body();
        if (!response.isSuccessful() || body == null) {
            throw new EnhancementException("Evaluator returned HTTP " + response.code());
        }
        JsonNode root = mapper.readTree(body.string());
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                return block.path("text").asText();
            }
        }
        throw new EnhancementException("No text content in evaluator response");
    }
}
