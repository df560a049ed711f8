package com.example.compliance.exception;

/**
 * The completion provider failed after all retry attempts.
 */
public class ModelCallException extends ComplianceException {

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
