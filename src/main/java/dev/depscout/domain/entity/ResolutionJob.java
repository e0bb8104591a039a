package dev.depscout.domain.entity;

import dev.depscout.domain.enums.JobStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of one resolution job.
 *
 * Design: UUID PK handed out as the opaque job id, JSONB columns for the submitted request and
 * the final report, optimistic locking (@Version) so that the pipeline and the deadline
 * watchdog cannot both apply a terminal transition.
 */
@Entity
@Table(name = "resolution_jobs", indexes = {
        @Index(name = "idx_job_status", columnList = "status"),
        @Index(name = "idx_job_expires", columnList = "expires_at")
})
public class ResolutionJob {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Version
    private Long version;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request", columnDefinition = "jsonb", nullable = false)
    private String requestJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "report", columnDefinition = "jsonb")
    private String reportJson;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected ResolutionJob() {
    }

    public static ResolutionJob create(String requestJson, Instant now, Duration retention) {
        ResolutionJob job = new ResolutionJob();
        job.id = UUID.randomUUID();
        job.status = JobStatus.PROCESSING;
        job.requestJson = requestJson;
        job.createdAt = now;
        job.updatedAt = now;
        job.expiresAt = now.plus(retention);
        return job;
    }

    public void markCompleted(String reportJson, Instant now) {
        requireProcessing(JobStatus.COMPLETED);
        this.status = JobStatus.COMPLETED;
        this.reportJson = reportJson;
        this.completedAt = now;
        this.updatedAt = now;
    }

    public void markFailed(String error, Instant now) {
        requireProcessing(JobStatus.FAILED);
        this.status = JobStatus.FAILED;
        this.errorMessage = truncate(error);
        this.completedAt = now;
        this.updatedAt = now;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    private void requireProcessing(JobStatus target) {
        if (status != JobStatus.PROCESSING)
            throw new IllegalStateException("Cannot move job %s from %s to %s".formatted(id, status, target));
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= 4000 ? error : error.substring(0, 4000);
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Long getVersion() {
        return version;
    }

    public String getRequestJson() {
        return requestJson;
    }

    public String getReportJson() {
        return reportJson;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
