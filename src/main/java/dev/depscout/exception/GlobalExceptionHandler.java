package dev.depscout.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps exceptions to RFC 7807 Problem Details.
 *
 * <p>Validation and not-found messages are safe to echo. Storage and unexpected errors are
 * logged server-side and answered with a generic detail.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SubmissionValidationException.class)
    public ProblemDetail handleInvalidSubmission(SubmissionValidationException ex) {
        log.warn("Rejected submission: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid-submission", "Invalid Submission");
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request body or parameter.", "bad-request", "Invalid Request");
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ProblemDetail handleNotFound(JobNotFoundException ex) {
        log.debug("Job lookup miss: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND,
                "The requested report ID does not exist or has expired.", "not-found", "Report not found");
    }

    @ExceptionHandler({JobStoreException.class, DataAccessException.class, TransactionException.class})
    public ProblemDetail handleStorage(RuntimeException ex) {
        log.error("Job store failure: {}", ex.getMessage(), ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE,
                "Job storage is temporarily unavailable. Please retry later.", "storage-unavailable", "Storage Unavailable");
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.", "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE,
                "Service temporarily unavailable. Please retry later.", "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please try again later.", "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://depscout.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
