package com.example.compliance.model;

/**
 * Per-stage timing of an analysis job (in seconds). A stage that did not run reports 0.
 *
 * @param extractionSeconds Stage 1: text extraction, cleaning and chunking
 * @param retrievalSeconds  Stage 2: context retrieval
 * @param analysisSeconds   Stage 3: model analysis
 * @param evaluationSeconds Stage 4: heuristic metrics
 * @param judgeSeconds      Stage 5: model-as-judge
 */
public record PipelineTimings(
        double extractionSeconds,
        double retrievalSeconds,
        double analysisSeconds,
        double evaluationSeconds,
        double judgeSeconds
) {
    public double totalSeconds() {
        return extractionSeconds + retrievalSeconds + analysisSeconds + evaluationSeconds + judgeSeconds;
    }
}
