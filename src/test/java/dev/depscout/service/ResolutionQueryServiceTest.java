package dev.depscout.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.depscout.domain.entity.ResolutionJob;
import dev.depscout.domain.enums.JobStatus;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.dto.response.ResolutionStatusResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResolutionQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private ResolutionJobStore jobStore;
    private ResolutionQueryService queryService;

    @BeforeEach
    void setUp() {
        jobStore = mock(ResolutionJobStore.class);
        queryService = new ResolutionQueryService(jobStore);
    }

    @Test
    @DisplayName("processing jobs echo their request")
    void processing() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        ResolutionRequest request = ResolutionRequest.of(List.of(Requirement.of("numpy", "", null)));
        when(jobStore.find(job.getId())).thenReturn(Optional.of(job));
        when(jobStore.readRequest(job)).thenReturn(request);

        Optional<ResolutionStatusResponse> status = queryService.findStatus(job.getId());

        assertThat(status).get().isInstanceOfSatisfying(ResolutionStatusResponse.Processing.class, p -> {
            assertThat(p.status()).isEqualTo(JobStatus.PROCESSING);
            assertThat(p.request()).isEqualTo(request);
            assertThat(p.createdAt()).isEqualTo(NOW);
        });
    }

    @Test
    @DisplayName("failed jobs expose the error")
    void failed() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        job.markFailed("resolver exploded", NOW);
        when(jobStore.find(job.getId())).thenReturn(Optional.of(job));

        assertThat(queryService.findStatus(job.getId())).get()
                .isEqualTo(new ResolutionStatusResponse.Failed(job.getId(), "resolver exploded", NOW));
    }

    @Test
    @DisplayName("completed jobs return the report with a status field")
    void completed() {
        ResolutionJob job = ResolutionJob.create("{}", NOW, Duration.ofDays(7));
        job.markCompleted("{\"id\":\"x\"}", NOW);
        ObjectNode report = new ObjectMapper().createObjectNode().put("id", "x");
        when(jobStore.find(job.getId())).thenReturn(Optional.of(job));
        when(jobStore.readReport(job)).thenReturn(report);

        Optional<ResolutionStatusResponse> status = queryService.findStatus(job.getId());

        assertThat(status).get().isInstanceOfSatisfying(ResolutionStatusResponse.Completed.class, c -> {
            assertThat(c.body().path("status").asText()).isEqualTo("completed");
            assertThat(c.body().path("id").asText()).isEqualTo("x");
        });
    }

    @Test
    @DisplayName("unknown ids are empty")
    void unknown() {
        UUID id = UUID.randomUUID();
        when(jobStore.find(id)).thenReturn(Optional.empty());

        assertThat(queryService.findStatus(id)).isEmpty();
    }
}
