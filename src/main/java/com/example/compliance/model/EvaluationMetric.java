package com.example.compliance.model;

/**
 * Heuristic metrics that can be enabled through {@code compliance.evaluation.metrics}.
 */
public enum EvaluationMetric {
    FAITHFULNESS,
    ANSWER_RELEVANCE,
    CONTEXT_PRECISION,
    CONTEXT_RECALL
}
