package com.evidencetrust.enhancement;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.evidencetrust.governance.Dimension;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Parses the JSON an evaluator answers with. The payload may be wrapped in a markdown code fence.
 */
public class EvaluatorResponseParser {
    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final Map<String, Dimension> ADJUSTMENT_FIELDS = Map.of(
            "methodology_adjustment", Dimension.METHODOLOGY,
            "completeness_adjustment", Dimension.COMPLETENESS,
            "bias_adjustment", Dimension.BIAS_DETECTION);

    private final ObjectMapper mapper;

    public EvaluatorResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public EnhancementResult parse(String text) {
        if (text == null || text.isBlank()) {
            throw new EnhancementException("Evaluator returned an empty response");
        }
        String json = text.trim();
        Matcher fenced = FENCE.matcher(json);
        if (fenced.find()) {
            json = fenced.group(1).trim();
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EnhancementException("Evaluator response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EnhancementException("Evaluator response is not a JSON object");
        }

        Map<Dimension, Double> adjustments = new EnumMap<>(Dimension.class);
        ADJUSTMENT_FIELDS.forEach((field, dimension) -> {
            JsonNode value = root.get(field);
            if (value == null || value.isNull()) {
                return;
            }
            if (!value.isNumber()) {
                throw new EnhancementException("Field " + field + " is not numeric: " + value);
            }
            adjustments.put(dimension, value.asDouble());
        });
        if (adjustments.isEmpty()) {
            throw new EnhancementException("Evaluator response carries no score adjustments");
        }

        List<ExternalFinding> findings = new ArrayList<>();
        for (JsonNode node : root.path("findings")) {
            findings.add(new ExternalFinding(
                    node.path("severity").asText(null),
                    node.path("category").asText(null),
                    node.path("description").asText(""),
                    node.path("remediation").asText("")));
        }
        return new EnhancementResult(adjustments, findings, root.path("narrative").asText(""));
    }
}
