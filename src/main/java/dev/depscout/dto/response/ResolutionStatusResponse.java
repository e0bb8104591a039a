package dev.depscout.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.depscout.domain.enums.JobStatus;
import dev.depscout.domain.valueobject.ResolutionRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * The three shapes {@code GET /resolutions/{id}} can return, one per job status.
 */
public sealed interface ResolutionStatusResponse
        permits ResolutionStatusResponse.Processing, ResolutionStatusResponse.Failed, ResolutionStatusResponse.Completed {

    JobStatus status();

    @JsonPropertyOrder({"id", "status", "created_at", "request", "message"})
    record Processing(UUID id, @JsonProperty("created_at") Instant createdAt, ResolutionRequest request)
            implements ResolutionStatusResponse {

        public static final String MESSAGE =
                "Dependency resolution is still in progress. Please check again in a few seconds.";

        @Override
        @JsonProperty("status")
        public JobStatus status() {
            return JobStatus.PROCESSING;
        }

        @JsonProperty("message")
        public String message() {
            return MESSAGE;
        }
    }

    @JsonPropertyOrder({"id", "status", "error", "created_at"})
    record Failed(UUID id, String error, @JsonProperty("created_at") Instant createdAt)
            implements ResolutionStatusResponse {

        @Override
        @JsonProperty("status")
        public JobStatus status() {
            return JobStatus.FAILED;
        }
    }

    /** The stored report with {@code "status": "completed"} added. */
    record Completed(ObjectNode report) implements ResolutionStatusResponse {

        @Override
        public JobStatus status() {
            return JobStatus.COMPLETED;
        }

        @JsonValue
        public ObjectNode body() {
            return report;
        }
    }
}
