package com.example.compliance.service;

import com.example.compliance.model.Analysis;
import com.example.compliance.model.ContextPassage;
import com.example.compliance.model.EvaluationMetric;
import com.example.compliance.model.EvaluationMetrics;
import com.example.compliance.model.Risk;
import com.example.compliance.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationScorerTest {

    private final EvaluationScorer scorer = new EvaluationScorer(EnumSet.allOf(EvaluationMetric.class));

    private static List<ContextPassage> sampleContext() {
        return List.of(
                new ContextPassage("Article 5: Prohibited AI Practices - biometric identification systems", 0.1, Map.of()),
                new ContextPassage("Article 6: High-risk AI systems in border control", 0.2, Map.of()),
                new ContextPassage("Article 9: Transparency obligations for providers", 0.3, Map.of())
        );
    }

    private static Analysis sampleAnalysis() {
        return Analysis.of("AI Border Control", "Automated border control using facial recognition",
                true, 0.95,
                List.of(new Risk("Biometric identification system", "Prohibited AI", RiskLevel.HIGH, "Article 5", 0.9)),
                List.of(new Risk("Data transparency requirements", "Transparency", RiskLevel.LOW, "Article 9", 0.7)));
    }

    private static Analysis noRisks() {
        return Analysis.of("Web App", "Basic website", false, 0.1, List.of(), List.of());
    }

    @Test
    @DisplayName("Faithfulness is exactly 1.0 without risks, for any context")
    void faithfulnessWithoutRisks() {
        assertEquals(1.0, scorer.calculateFaithfulness(sampleContext(), noRisks()));
        assertEquals(1.0, scorer.calculateFaithfulness(List.of(), noRisks()));
    }

    @Test
    @DisplayName("Faithfulness counts risks with two grounded terms")
    void faithfulnessCountsGroundedRisks() {
        // "biometric" and "identification" occur in context; the second risk only has "transparency"
        double score = scorer.calculateFaithfulness(sampleContext(), sampleAnalysis());

        assertEquals(0.5, score, 1e-9);
    }

    @Test
    @DisplayName("Context precision is exactly 0.0 for empty context")
    void precisionWithEmptyContext() {
        assertEquals(0.0, scorer.calculateContextPrecision(List.of(), sampleAnalysis()));
        assertEquals(0.0, scorer.calculateContextPrecision(List.of(), noRisks()));
    }

    @Test
    @DisplayName("Context precision is the share of passages citing a risk reference")
    void precisionCountsCitedPassages() {
        double score = scorer.calculateContextPrecision(sampleContext(), sampleAnalysis());

        assertEquals(2.0 / 3.0, score, 1e-9);
    }

    @Test
    @DisplayName("Context recall counts referenced or grounded risks")
    void recallCountsSupportedRisks() {
        assertEquals(1.0, scorer.calculateContextRecall(sampleContext(), sampleAnalysis()));
        assertEquals(1.0, scorer.calculateContextRecall(sampleContext(), noRisks()));

        Analysis unsupported = Analysis.of("X", "y", true, 0.5,
                List.of(new Risk("Unrelated speculative concern", "Other", RiskLevel.HIGH, null, null)), List.of());
        assertEquals(0.0, scorer.calculateContextRecall(sampleContext(), unsupported));
    }

    @Test
    @DisplayName("Answer relevance is 0.0 for an empty description and capped at 1.0")
    void answerRelevanceBounds() {
        Analysis empty = Analysis.of("X", "", true, 0.5, List.of(), List.of());
        assertEquals(0.0, scorer.calculateAnswerRelevance(empty, "anything"));

        Analysis full = Analysis.of("X", "neural model for border control", true, 0.9, List.of(), List.of());
        assertEquals(1.0, scorer.calculateAnswerRelevance(full, "A neural model for border control"));
    }

    @Test
    @DisplayName("Answer relevance is boosted when AI detection agrees with the document")
    void answerRelevanceBoost() {
        String document = "This system uses a neural network for border screening";
        Analysis agrees = Analysis.of("X", "border screening tool", true, 0.9, List.of(), List.of());
        Analysis disagrees = Analysis.of("X", "border screening tool", false, 0.1, List.of(), List.of());

        double boosted = scorer.calculateAnswerRelevance(agrees, document);
        double plain = scorer.calculateAnswerRelevance(disagrees, document);

        assertEquals(2.0 / 3.0, plain, 1e-9);
        assertEquals(Math.min(1.0, plain * 1.2), boosted, 1e-9);
    }

    @Test
    @DisplayName("Overall score is the mean of enabled metrics for every combination")
    void overallIsMeanOfEnabledMetrics() {
        EvaluationMetric[] all = EvaluationMetric.values();
        for (int mask = 0; mask < (1 << all.length); mask++) {
            // Given
            Set<EvaluationMetric> enabled = EnumSet.noneOf(EvaluationMetric.class);
            for (int i = 0; i < all.length; i++) {
                if ((mask & (1 << i)) != 0) enabled.add(all[i]);
            }
            EvaluationScorer subset = new EvaluationScorer(enabled);

            // When
            EvaluationMetrics metrics = subset.evaluate(sampleContext(), sampleAnalysis(),
                    "Automated border control using facial recognition and machine learning");

            // Then
            List<Double> present = new ArrayList<>();
            for (Double value : new Double[]{metrics.faithfulness(), metrics.answerRelevance(),
                    metrics.contextPrecision(), metrics.contextRecall()}) {
                if (value != null) present.add(value);
            }
            assertEquals(enabled.size(), present.size());
            double expected = present.isEmpty() ? 0.0
                    : present.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            assertEquals(expected, metrics.overallScore(), 0.01, "metrics " + enabled);
        }
    }

    @Test
    @DisplayName("Identical inputs produce identical metrics")
    void evaluationIsDeterministic() {
        String document = "Automated border control using facial recognition";

        assertEquals(scorer.evaluate(sampleContext(), sampleAnalysis(), document),
                scorer.evaluate(sampleContext(), sampleAnalysis(), document));
    }
}
