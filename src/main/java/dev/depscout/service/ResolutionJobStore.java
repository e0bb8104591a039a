package dev.depscout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.depscout.config.JobProperties;
import dev.depscout.domain.entity.ResolutionJob;
import dev.depscout.domain.valueobject.Report;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.exception.JobStoreException;
import dev.depscout.repository.ResolutionJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable job state keyed by job id.
 *
 * <p>Terminal writes ({@link #complete}, {@link #fail}) are first-writer-wins: a write against
 * a job that is already terminal, or that loses the {@code @Version} race, is discarded and
 * reported as {@code false}. Expired jobs are invisible to {@link #find}.
 *
 * <p>Database and transaction-manager failures surface as {@link JobStoreException}.
 *
 * <p>Not {@code @Transactional} as a whole: each repository call runs in its own transaction so
 * a lost optimistic-lock race surfaces here, where it can be handled.
 */
@Service
public class ResolutionJobStore {

    private static final Logger log = LoggerFactory.getLogger(ResolutionJobStore.class);

    private final ResolutionJobRepository repository;
    private final ObjectMapper objectMapper;
    private final JobProperties jobProperties;
    private final Clock clock;

    public ResolutionJobStore(ResolutionJobRepository repository, ObjectMapper objectMapper,
                              JobProperties jobProperties, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.jobProperties = jobProperties;
        this.clock = clock;
    }

    public ResolutionJob create(ResolutionRequest request) {
        ResolutionJob job = ResolutionJob.create(toJson(request), clock.instant(), jobProperties.retention());
        try {
            return repository.save(job);
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("Could not record new resolution job", e);
        }
    }

    public Optional<ResolutionJob> find(UUID id) {
        Instant now = clock.instant();
        try {
            return repository.findById(id).filter(job -> !job.isExpired(now));
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("Could not read resolution job " + id, e);
        }
    }

    public boolean complete(UUID id, Report report) {
        String reportJson = toJson(report);
        return transition(id, "completed", job -> job.markCompleted(reportJson, clock.instant()));
    }

    public boolean fail(UUID id, String error) {
        return transition(id, "failed", job -> job.markFailed(error, clock.instant()));
    }

    public long purgeExpired() {
        try {
            return repository.deleteByExpiresAtBefore(clock.instant());
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("Could not purge expired resolution jobs", e);
        }
    }

    public ResolutionRequest readRequest(ResolutionJob job) {
        return fromJson(job.getRequestJson(), ResolutionRequest.class, job.getId());
    }

    public JsonNode readReport(ResolutionJob job) {
        try {
            return objectMapper.readTree(job.getReportJson());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobStoreException("Stored report for job %s is unreadable".formatted(job.getId()), e);
        }
    }

    private boolean transition(UUID id, String target, Consumer<ResolutionJob> change) {
        try {
            Optional<ResolutionJob> found = repository.findById(id);
            if (found.isEmpty()) {
                log.warn("Cannot mark job {} {}: no such job", id, target);
                return false;
            }
            ResolutionJob job = found.get();
            if (job.getStatus().isTerminal()) {
                log.warn("Discarding {} write for job {}: already {}", target, id, job.getStatus().wireValue());
                return false;
            }
            change.accept(job);
            repository.save(job);
            log.info("Job {} marked {}", id, target);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Discarding {} write for job {}: concurrent terminal write won", target, id);
            return false;
        } catch (DataAccessException | TransactionException e) {
            throw new JobStoreException("Could not mark job %s %s".formatted(id, target), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type, UUID jobId) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Stored %s for job %s is unreadable".formatted(type.getSimpleName(), jobId), e);
        }
    }
}
