package dev.depscout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.depscout.domain.entity.ResolutionJob;
import dev.depscout.dto.response.ResolutionStatusResponse;
import dev.depscout.exception.JobStoreException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/** Read-side service. Unknown and expired jobs are both reported as absent. */
@Service
public class ResolutionQueryService {
    private final ResolutionJobStore jobStore;

    public ResolutionQueryService(ResolutionJobStore jobStore) { this.jobStore = jobStore; }

    public Optional<ResolutionStatusResponse> findStatus(UUID id) {
        return jobStore.find(id).map(this::toResponse);
    }

    private ResolutionStatusResponse toResponse(ResolutionJob job) {
        return switch (job.getStatus()) {
            case PROCESSING -> new ResolutionStatusResponse.Processing(job.getId(), job.getCreatedAt(),
                    jobStore.readRequest(job));
            case FAILED -> new ResolutionStatusResponse.Failed(job.getId(), job.getErrorMessage(), job.getCreatedAt());
            case COMPLETED -> new ResolutionStatusResponse.Completed(completedBody(job));
        };
    }

    private ObjectNode completedBody(ResolutionJob job) {
        JsonNode report = jobStore.readReport(job);
        if (!(report instanceof ObjectNode body)) {
            throw new JobStoreException("Stored report for job %s is not an object".formatted(job.getId()), null);
        }
        body.put("status", job.getStatus().wireValue());
        return body;
    }
}
