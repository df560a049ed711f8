package com.example.compliance.exception;

/**
 * The model answered, but not with the structured output that was asked for.
 * Never retried.
 */
public class ModelOutputParseException extends ComplianceException {

    public ModelOutputParseException(String message) {
        super(message);
    }

    public ModelOutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
