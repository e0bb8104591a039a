package dev.depscout.exception;

/** Unknown or expired job id. */
public class JobNotFoundException extends RuntimeException {
    public JobNotFoundException(String jobId) {
        super("The requested report ID does not exist or has expired: " + jobId);
    }
}
