package com.example.compliance.exception;

/**
 * Base class of the analyzer's error taxonomy.
 */
public class ComplianceException extends RuntimeException {

    public ComplianceException(String message) {
        super(message);
    }

    public ComplianceException(String message, Throwable cause) {
        super(message, cause);
    }
}
