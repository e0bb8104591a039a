package dev.depscout.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.depscout.config.JobProperties;
import dev.depscout.domain.entity.ResolutionJob;
import dev.depscout.domain.enums.JobStatus;
import dev.depscout.domain.valueobject.Report;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.domain.valueobject.ResolutionResult;
import dev.depscout.exception.JobStoreException;
import dev.depscout.repository.ResolutionJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResolutionJobStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ResolutionJobRepository repository;
    private ObjectMapper objectMapper;
    private ResolutionJobStore store;

    @BeforeEach
    void setUp() {
        repository = mock(ResolutionJobRepository.class);
        objectMapper = JsonMapper.builder().findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build();
        store = new ResolutionJobStore(repository, objectMapper, new JobProperties(Duration.ofDays(7)),
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(repository.save(any(ResolutionJob.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("create persists the request as JSON with a retention deadline")
    void createPersistsRequest() {
        ResolutionJob job = store.create(ResolutionRequest.of(List.of(Requirement.of("numpy", "", null))));

        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
        assertThat(job.getRequestJson()).contains("\"python_version\":\"3.9\"", "\"original_spec\":\"numpy\"");
        assertThat(store.readRequest(job).requirements()).extracting(Requirement::name).containsExactly("numpy");
    }

    @Test
    @DisplayName("expired jobs are invisible")
    void expiredJobsHidden() {
        ResolutionJob old = ResolutionJob.create("{}", NOW.minus(Duration.ofDays(8)), Duration.ofDays(7));
        when(repository.findById(old.getId())).thenReturn(Optional.of(old));

        assertThat(store.find(old.getId())).isEmpty();
    }

    @Test
    @DisplayName("complete stores the report JSON")
    void completeStoresReport() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));

        boolean written = store.complete(job.getId(), report(job.getId()));

        assertThat(written).isTrue();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        JsonNode stored = store.readReport(job);
        assertThat(stored.path("manifest_text").asText()).isEqualTo("numpy==1.24.3\n");
        assertThat(stored.path("metadata").path("processing_time_ms").asLong()).isEqualTo(42);
        assertThat(stored.path("created_at").asText()).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    @DisplayName("writes against a terminal job are discarded")
    void terminalJobIgnoresWrites() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        job.markFailed("deadline", NOW);
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));

        assertThat(store.complete(job.getId(), report(job.getId()))).isFalse();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("losing the optimistic-lock race is not an error")
    void optimisticLockLoserReturnsFalse() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        when(repository.findById(job.getId())).thenReturn(Optional.of(job));
        when(repository.save(job)).thenThrow(new ObjectOptimisticLockingFailureException(ResolutionJob.class, job.getId()));

        assertThat(store.fail(job.getId(), "late")).isFalse();
    }

    @Test
    @DisplayName("unknown jobs cannot be transitioned")
    void unknownJob() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenReturn(Optional.empty());

        assertThat(store.fail(id, "x")).isFalse();
    }

    @Test
    @DisplayName("database errors surface as storage failures")
    void storageFailure() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> store.find(id)).isInstanceOf(JobStoreException.class);
        assertThatThrownBy(() -> store.fail(id, "x")).isInstanceOf(JobStoreException.class);
    }

    @Test
    @DisplayName("a transaction that cannot be opened is a storage failure too")
    void transactionFailure() {
        UUID id = UUID.randomUUID();
        when(repository.findById(id)).thenThrow(new CannotCreateTransactionException("no connection"));
        when(repository.save(any())).thenThrow(new CannotCreateTransactionException("no connection"));

        assertThatThrownBy(() -> store.find(id)).isInstanceOf(JobStoreException.class);
        assertThatThrownBy(() -> store.fail(id, "x")).isInstanceOf(JobStoreException.class);
        assertThatThrownBy(() -> store.create(ResolutionRequest.of(List.of(Requirement.of("numpy", "", null)))))
                .isInstanceOf(JobStoreException.class)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
    }

    @Test
    @DisplayName("purge deletes everything past its expiry")
    void purgeExpired() {
        when(repository.deleteByExpiresAtBefore(NOW)).thenReturn(3L);

        assertThat(store.purgeExpired()).isEqualTo(3);
    }

    private static Report report(UUID id) {
        return new Report(id, NOW, ResolutionRequest.of(List.of(Requirement.of("numpy", "", null))),
                ResolutionResult.of(List.of(), List.of(), List.of(), List.of()),
                "numpy==1.24.3\n", "# report", List.of(), new Report.Metadata("3.9", 1, 0, 0, 42));
    }
}
