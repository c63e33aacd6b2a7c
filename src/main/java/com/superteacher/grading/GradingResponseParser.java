package com.superteacher.grading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON body returned by a grading collaborator.
 *
 * <p>Required fields: {@code score}, {@code feedback}, {@code strengths},
 * {@code areas_for_improvement}, {@code suggested_points}. Optional:
 * {@code is_relevant} (default true) and the Economics criterion scores
 * {@code conceptsScore}, {@code diagramScore}, {@code applicationScore},
 * {@code terminologyScore}. Text around the JSON object is ignored.
 */
public class GradingResponseParser {
    static final Map<String, String> CRITERIA = Collections.unmodifiableMap(criteria());

    private final ObjectMapper objectMapper;

    public GradingResponseParser() {
        this(new ObjectMapper());
    }

    public GradingResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Structurally valid grading payload, before any clamping.
     */
    public record RemoteGrade(
            double score,
            String feedback,
            List<String> strengths,
            List<String> areasForImprovement,
            List<String> suggestedPoints,
            boolean relevant,
            Map<String, Double> criterionScores
    ) {
    }

    public static class InvalidGradingResponseException extends IOException {
        public InvalidGradingResponseException(String message) {
            super(message);
        }

        public InvalidGradingResponseException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public RemoteGrade parse(String content) throws InvalidGradingResponseException {
        if (content == null || content.isBlank()) {
            throw new InvalidGradingResponseException("empty grading response");
        }
        int jsonStart = content.indexOf('{');
        int jsonEnd = content.lastIndexOf('}') + 1;
        if (jsonStart < 0 || jsonEnd <= jsonStart) {
            throw new InvalidGradingResponseException("no JSON object in grading response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content.substring(jsonStart, jsonEnd));
        } catch (JsonProcessingException e) {
            throw new InvalidGradingResponseException("malformed grading JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidGradingResponseException("grading response is not a JSON object");
        }

        double score = requireScore(root);
        String feedback = require(root, "feedback").asText();
        List<String> strengths = requireList(root, "strengths");
        List<String> areas = requireList(root, "areas_for_improvement");
        List<String> suggestions = requireList(root, "suggested_points");
        JsonNode relevance = root.get("is_relevant");
        boolean relevant = relevance == null || relevance.isNull() || relevance.asBoolean(true);

        Map<String, Double> criterionScores = new LinkedHashMap<>();
        CRITERIA.forEach((field, label) -> {
            JsonNode value = root.get(field);
            if (value != null && value.isNumber()) {
                criterionScores.put(label, value.asDouble());
            }
        });
        return new RemoteGrade(score, feedback, strengths, areas, suggestions, relevant, criterionScores);
    }

    private static double requireScore(JsonNode root) throws InvalidGradingResponseException {
        JsonNode node = require(root, "score");
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidGradingResponseException("score is not a number: " + node.asText(), e);
            }
        }
        throw new InvalidGradingResponseException("score is not a number: " + node);
    }

    private static JsonNode require(JsonNode root, String field) throws InvalidGradingResponseException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new InvalidGradingResponseException("grading response is missing '" + field + "'");
        }
        return node;
    }

    private static List<String> requireList(JsonNode root, String field) throws InvalidGradingResponseException {
        JsonNode node = require(root, field);
        if (!node.isArray()) {
            throw new InvalidGradingResponseException("'" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isNull() && !item.asText().isBlank()) {
                values.add(item.asText().trim());
            }
        }
        return values;
    }

    private static Map<String, String> criteria() {
        Map<String, String> criteria = new LinkedHashMap<>();
        criteria.put("conceptsScore", "Economic Concepts");
        criteria.put("diagramScore", "Diagram Accuracy");
        criteria.put("applicationScore", "Application of Theories");
        criteria.put("terminologyScore", "Use of Terminology");
        return criteria;
    }
}
