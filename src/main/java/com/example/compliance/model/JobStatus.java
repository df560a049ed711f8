package com.example.compliance.model;

/**
 * Lifecycle of an analysis job. COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
