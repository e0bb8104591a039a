package dev.depscout.dto.response;

import dev.depscout.domain.enums.JobStatus;

import java.util.UUID;

public record SubmissionResponse(UUID id, JobStatus status, String message) {

    public static SubmissionResponse accepted(UUID id) {
        return new SubmissionResponse(id, JobStatus.PROCESSING,
                "Dependency resolution started. Poll GET /resolutions/%s to check progress.".formatted(id));
    }
}
