package dev.depscout.exception;

/**
 * Rejected submission: empty requirement list or a malformed requirement. Raised before any
 * job is created.
 */
public class SubmissionValidationException extends RuntimeException {
    public SubmissionValidationException(String message) {
        super(message);
    }
}
