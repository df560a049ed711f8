package com.example.compliance.exception;

/**
 * The submitted document could not be turned into text. Fatal for the job.
 */
public class ExtractionException extends ComplianceException {

    public enum Reason {
        /** The file extension is not handled by any extractor. */
        UNSUPPORTED_FORMAT,
        /** The file has a supported extension but its content could not be parsed. */
        PARSE_FAILURE
    }

    private final Reason reason;

    public ExtractionException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
