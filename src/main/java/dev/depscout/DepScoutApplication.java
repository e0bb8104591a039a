package dev.depscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DepScout: asynchronous Python dependency resolution service.
 *
 * <p>Request flow:
 * <pre>
 * POST /resolutions → ResolutionService (validate, persist job) → 202 + job id
 *   → ResolutionOrchestrator (background) → PackageResearchAgent → ResolutionEngine
 *   → ReportCompiler → ResolutionJobStore (completed | failed)
 * GET /resolutions/{id} → ResolutionQueryService
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Async-first: submissions return 202 immediately, the pipeline runs on a bounded pool</li>
 *   <li>Per-package isolation: one failed lookup becomes a warning, never a failed job</li>
 *   <li>Every job reaches a terminal state, enforced by a deadline watchdog</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
@EnableScheduling
public class DepScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(DepScoutApplication.class, args);
    }
}
