package com.example.compliance.model;

import com.example.compliance.exception.ModelOutputParseException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the model's JSON output into typed records.
 * <p>
 * This is the only place untyped model output is read. Missing optional fields get
 * explicit defaults; values of the wrong shape or out of range are rejected with
 * {@link ModelOutputParseException}.
 */
public final class ModelOutputDecoder {

    static final String DEFAULT_PROJECT_NAME = "Unknown Project";

    private ModelOutputDecoder() {
    }

    /**
     * Decodes an analysis object. Risks from {@code high_risks} get level HIGH, those
     * from {@code low_risks} level LOW.
     */
    public static Analysis decodeAnalysis(JsonNode node) {
        requireObject(node, "analysis");

        String projectName = text(node, "project_name", DEFAULT_PROJECT_NAME);
        String description = text(node, "description", "");
        boolean containsAi = bool(node, "contains_ai", false);
        Double aiConfidence = unitInterval(node, "ai_confidence");

        List<Risk> highRisks = risks(node, "high_risks", RiskLevel.HIGH);
        List<Risk> lowRisks = risks(node, "low_risks", RiskLevel.LOW);

        return Analysis.of(projectName, description, containsAi,
                aiConfidence != null ? aiConfidence : 0.0, highRisks, lowRisks);
    }

    /**
     * Decodes a judge verdict. All four scores and the reasoning are mandatory.
     */
    public static JudgeVerdict decodeJudge(JsonNode node) {
        requireObject(node, "judge verdict");

        double accuracy = requiredScore(node, "accuracy_score");
        double completeness = requiredScore(node, "completeness_score");
        double consistency = requiredScore(node, "consistency_score");
        double overall = requiredScore(node, "overall_score");

        JsonNode reasoning = node.get("reasoning");
        if (isMissing(reasoning) || !reasoning.isTextual()) {
            throw new ModelOutputParseException("Judge verdict is missing 'reasoning'");
        }
        return new JudgeVerdict(accuracy, completeness, consistency, overall, reasoning.asText());
    }

    private static List<Risk> risks(JsonNode node, String field, RiskLevel level) {
        JsonNode array = node.get(field);
        if (isMissing(array)) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new ModelOutputParseException("'%s' must be an array, got %s".formatted(field, array.getNodeType()));
        }
        List<Risk> risks = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            requireObject(item, field + " entry");
            risks.add(new Risk(
                    text(item, "description", ""),
                    text(item, "category", "Unknown"),
                    level,
                    text(item, "eu_act_reference", null),
                    unitInterval(item, "confidence_score")
            ));
        }
        return risks;
    }

    private static double requiredScore(JsonNode node, String field) {
        Double value = unitInterval(node, field);
        if (value == null) {
            throw new ModelOutputParseException("Judge verdict is missing '%s'".formatted(field));
        }
        return value;
    }

    /** A number in [0,1], or null when absent. */
    private static Double unitInterval(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (isMissing(value)) {
            return null;
        }
        double number;
        if (value.isNumber()) {
            number = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                number = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new ModelOutputParseException("'%s' is not a number: %s".formatted(field, value.asText()), e);
            }
        } else {
            throw new ModelOutputParseException("'%s' is not a number: %s".formatted(field, value));
        }
        if (Double.isNaN(number) || number < 0.0 || number > 1.0) {
            throw new ModelOutputParseException("'%s' must be within [0, 1], got %s".formatted(field, number));
        }
        return number;
    }

    private static boolean bool(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (isMissing(value)) return defaultValue;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isTextual()) {
            String raw = value.asText().trim();
            if (raw.equalsIgnoreCase("true")) return true;
            if (raw.equalsIgnoreCase("false")) return false;
        }
        throw new ModelOutputParseException("'%s' is not a boolean: %s".formatted(field, value));
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (isMissing(value)) return defaultValue;
        if (value.isContainerNode()) {
            throw new ModelOutputParseException("'%s' must be a string, got %s".formatted(field, value.getNodeType()));
        }
        return value.asText();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new ModelOutputParseException("Expected a JSON object for the %s, got %s"
                    .formatted(what, node == null ? "nothing" : node.getNodeType()));
        }
    }

    private static boolean isMissing(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }
}
