package dev.depscout.exception;

/**
 * Job store read/write failure. Surfaced to callers as a storage problem, distinct from a job
 * whose pipeline failed.
 */
public class JobStoreException extends RuntimeException {
    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
