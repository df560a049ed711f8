package com.example.compliance.exception;

/**
 * The embedding provider failed after all retry attempts.
 */
public class EmbeddingException extends ComplianceException {

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
