package dev.depscout.integration;

import com.fasterxml.jackson.databind.JsonNode;
import dev.depscout.domain.enums.JobStatus;
import dev.depscout.repository.ResolutionJobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Submits jobs over HTTP and polls them to a terminal state against a real database.
 */
class ResolutionFlowIntegrationTest extends BaseIntegrationTest {

    private static final Duration POLL_TIMEOUT = Duration.ofSeconds(20);

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ResolutionJobRepository repository;

    @Test
    @DisplayName("built-in modules resolve without the registry and the job completes")
    void builtInModulesComplete() throws InterruptedException {
        Map<String, Object> body = Map.of(
                "requirements_txt", "imp\noptparse\nghost-package==1.0",
                "python_version", "3.11");

        ResponseEntity<JsonNode> submitted = rest.postForEntity("/resolutions", body, JsonNode.class);

        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String id = submitted.getBody().path("id").asText();
        assertThat(submitted.getBody().path("status").asText()).isEqualTo("processing");

        JsonNode report = pollUntilTerminal(id);

        assertThat(report.path("status").asText()).isEqualTo("completed");
        assertThat(report.path("id").asText()).isEqualTo(id);
        assertThat(report.path("manifest_text").asText())
                .startsWith("# Python Requirements File")
                .contains("optparse==built-in");
        assertThat(report.path("resolution_result").path("warnings").toString())
                .contains("Could not find package 'ghost-package'");
        assertThat(report.path("metadata").path("total_packages").asInt()).isEqualTo(3);

        assertThat(repository.findById(UUID.fromString(id)))
                .get()
                .satisfies(job -> {
                    assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
                    assertThat(job.getCompletedAt()).isNotNull();
                });
    }

    @Test
    @DisplayName("empty submissions are rejected before a job is created")
    void emptySubmissionRejected() {
        long before = repository.count();

        ResponseEntity<JsonNode> response = rest.postForEntity("/resolutions",
                Map.of("requirements", java.util.List.of()), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().path("detail").asText())
                .isEqualTo("Invalid request. Please provide at least one requirement.");
        assertThat(repository.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("unknown ids answer 404")
    void unknownIdNotFound() {
        ResponseEntity<JsonNode> response = rest.getForEntity("/resolutions/" + UUID.randomUUID(), JsonNode.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    private JsonNode pollUntilTerminal(String id) throws InterruptedException {
        Instant deadline = Instant.now().plus(POLL_TIMEOUT);
        JsonNode body;
        do {
            body = rest.getForObject("/resolutions/" + id, JsonNode.class);
            if (!"processing".equals(body.path("status").asText())) {
                return body;
            }
            Thread.sleep(200);
        } while (Instant.now().isBefore(deadline));
        throw new AssertionError("Job " + id + " still processing after " + POLL_TIMEOUT + ": " + body);
    }
}
