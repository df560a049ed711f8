package com.example.compliance.model;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Heuristic RAG evaluation scores. A component is {@code null} when its metric is disabled.
 *
 * @param faithfulness     share of risks lexically grounded in the retrieved context
 * @param answerRelevance  overlap between the analysis description and the document
 * @param contextPrecision share of passages cited by at least one risk reference
 * @param contextRecall    share of risks supported by a reference or by the context
 * @param overallScore     mean of the present components, 0.0 if none
 */
public record EvaluationMetrics(
        Double faithfulness,
        Double answerRelevance,
        Double contextPrecision,
        Double contextRecall,
        double overallScore
) {

    /**
     * Builds the metrics, computing {@code overallScore} as the mean of the non-null components.
     */
    public static EvaluationMetrics of(Double faithfulness, Double answerRelevance,
                                       Double contextPrecision, Double contextRecall) {
        double overall = Stream.of(faithfulness, answerRelevance, contextPrecision, contextRecall)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);
        return new EvaluationMetrics(faithfulness, answerRelevance, contextPrecision, contextRecall, overall);
    }
}
