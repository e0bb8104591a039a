package dev.depscout.domain.event;

import dev.depscout.domain.valueobject.ResolutionRequest;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published when a submission has been validated and its job row written.
 * Consumed after commit to start the background pipeline.
 */
public record ResolutionRequestedEvent(
        UUID jobId,
        ResolutionRequest request,
        Instant submittedAt
) {
    public ResolutionRequestedEvent {
        if (jobId == null) throw new IllegalArgumentException("jobId required");
        if (request == null) throw new IllegalArgumentException("request required");
        if (submittedAt == null) submittedAt = Instant.now();
    }
}
