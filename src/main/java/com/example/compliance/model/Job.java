package com.example.compliance.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One analysis submission and its outcome.
 * <p>
 * Instances are immutable: every transition returns a new {@code Job}. A job in a
 * terminal state (COMPLETED or FAILED) refuses further transitions.
 *
 * @param id           unique job id, never reused
 * @param documentName name of the submitted document
 * @param status       lifecycle state
 * @param analysis     structured analysis, set on completion
 * @param metrics      heuristic evaluation metrics, set on completion
 * @param judge        judge verdict, null when judging is disabled or failed
 * @param timings      per-stage timings, set on completion
 * @param createdAt    submission time
 * @param completedAt  time the job reached a terminal state
 * @param error        failure message, set only when FAILED
 */
@Document(collection = "analysis_jobs")
public record Job(
        @Id String id,
        String documentName,
        JobStatus status,
        Analysis analysis,
        EvaluationMetrics metrics,
        JudgeVerdict judge,
        PipelineTimings timings,
        Instant createdAt,
        Instant completedAt,
        String error
) {

    /** Creates a new job in PENDING. */
    public static Job pending(String id, String documentName, Instant createdAt) {
        return new Job(id, documentName, JobStatus.PENDING, null, null, null, null, createdAt, null, null);
    }

    /** PENDING → PROCESSING. */
    public Job processing() {
        if (status != JobStatus.PENDING) {
            throw new IllegalStateException("Job %s cannot start processing from %s".formatted(id, status));
        }
        return new Job(id, documentName, JobStatus.PROCESSING, null, null, null, null, createdAt, null, null);
    }

    /** PROCESSING → COMPLETED. {@code judge} may be null. */
    public Job completed(Analysis analysis, EvaluationMetrics metrics, JudgeVerdict judge,
                         PipelineTimings timings, Instant completedAt) {
        if (status != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job %s cannot complete from %s".formatted(id, status));
        }
        if (analysis == null || metrics == null) {
            throw new IllegalArgumentException("A completed job requires an analysis and metrics");
        }
        return new Job(id, documentName, JobStatus.COMPLETED, analysis, metrics, judge, timings,
                createdAt, completedAt, null);
    }

    /** Any non-terminal state → FAILED, keeping the error message verbatim. */
    public Job failed(String error, Instant completedAt) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Job %s is already %s".formatted(id, status));
        }
        return new Job(id, documentName, JobStatus.FAILED, null, null, null, null,
                createdAt, completedAt, error);
    }
}
