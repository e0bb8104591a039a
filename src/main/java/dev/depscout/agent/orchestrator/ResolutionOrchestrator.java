package dev.depscout.agent.orchestrator;

import dev.depscout.agent.report.ReportCompiler;
import dev.depscout.agent.research.PackageResearchAgent;
import dev.depscout.agent.resolution.ResolutionEngine;
import dev.depscout.config.PipelineProperties;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.domain.valueobject.Report;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.domain.valueobject.ResolutionResult;
import dev.depscout.service.ResolutionJobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs the resolution pipeline for one job in the background.
 *
 * <pre>
 *  1. Research every distinct package name (sequential)
 *  2. Resolve versions and detect duplicate-name conflicts
 *  3. Compile the report
 *  4. Persist the report and mark the job COMPLETED
 * </pre>
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Supervised task</b>: every exception inside a phase is caught and becomes a
 *       FAILED job with the exception message. Nothing escapes to the executor.</li>
 *   <li><b>Deadline watchdog</b>: {@code orTimeout} marks the job FAILED once
 *       {@code depscout.pipeline.deadline} has passed. The running work is not interrupted;
 *       its later completion write is discarded by the job store.</li>
 *   <li><b>Rejection</b>: a saturated executor fails the job at once rather than leaving it
 *       in PROCESSING forever.</li>
 * </ul>
 */
@Component
public class ResolutionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResolutionOrchestrator.class);

    static final String MDC_JOB_ID = "jobId";

    private final PackageResearchAgent researchAgent;
    private final ResolutionEngine resolutionEngine;
    private final ReportCompiler reportCompiler;
    private final ResolutionJobStore jobStore;
    private final TaskExecutor resolutionExecutor;
    private final Duration deadline;
    private final MeterRegistry meterRegistry;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public ResolutionOrchestrator(PackageResearchAgent researchAgent,
                                  ResolutionEngine resolutionEngine,
                                  ReportCompiler reportCompiler,
                                  ResolutionJobStore jobStore,
                                  @Qualifier("resolutionExecutor") TaskExecutor resolutionExecutor,
                                  PipelineProperties pipelineProperties,
                                  MeterRegistry meterRegistry) {
        this.researchAgent = researchAgent;
        this.resolutionEngine = resolutionEngine;
        this.reportCompiler = reportCompiler;
        this.jobStore = jobStore;
        this.resolutionExecutor = resolutionExecutor;
        this.deadline = pipelineProperties.deadline();
        this.meterRegistry = meterRegistry;
        this.completedCounter = Counter.builder("depscout.pipeline.jobs")
                .description("Resolution jobs by terminal outcome")
                .tag("outcome", "completed")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("depscout.pipeline.jobs")
                .description("Resolution jobs by terminal outcome")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    /**
     * Hands the pipeline to the executor and returns immediately.
     */
    public CompletableFuture<Void> launch(UUID jobId, ResolutionRequest request, Instant submittedAt) {
        CompletableFuture<Void> pipeline;
        try {
            pipeline = CompletableFuture.runAsync(() -> executePipeline(jobId, request, submittedAt), resolutionExecutor);
        } catch (RejectedExecutionException e) {
            // TaskRejectedException extends RejectedExecutionException
            log.error("Resolution {} rejected by executor: {}", jobId, e.getMessage());
            recordFailure(jobId, "Resolution could not be scheduled: " + e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        log.info("Resolution {} scheduled ({} requirements, deadline {})", jobId, request.requirements().size(), deadline);

        return pipeline
                .orTimeout(deadline.toMillis(), TimeUnit.MILLISECONDS)
                // orTimeout fires on the JDK's shared delay thread; the store write must not run there
                .exceptionallyAsync(ex -> {
                    onAbnormalEnd(jobId, ex);
                    return null;
                }, resolutionExecutor);
    }

    private void onAbnormalEnd(UUID jobId, Throwable ex) {
        MDC.put(MDC_JOB_ID, jobId.toString());
        try {
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof TimeoutException) {
                log.error("Resolution {} exceeded deadline {}", jobId, deadline);
                recordFailure(jobId, "Resolution exceeded the deadline of " + deadline);
            } else {
                log.error("Resolution {} terminated unexpectedly", jobId, cause);
                recordFailure(jobId, messageOf(cause));
            }
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    /**
     * The supervised pipeline body. Never throws: any failure ends in a FAILED job.
     */
    void executePipeline(UUID jobId, ResolutionRequest request, Instant submittedAt) {
        MDC.put(MDC_JOB_ID, jobId.toString());
        try {
            log.info("Starting resolution {} for {} requirements", jobId, request.requirements().size());

            List<String> names = request.requirements().stream().map(Requirement::name).toList();
            Map<String, PackageResearchOutcome> research =
                    timed("research", () -> researchAgent.researchMany(names));
            log.info("Researched {} packages ({} failed lookups)", research.size(),
                    research.values().stream().filter(PackageResearchOutcome::isFailure).count());

            ResolutionResult result = timed("resolve",
                    () -> resolutionEngine.resolve(request.requirements(), research));

            Report report = timed("compile",
                    () -> reportCompiler.compile(jobId, request, result, research, submittedAt));

            if (jobStore.complete(jobId, report)) {
                completedCounter.increment();
                log.info("Resolution {} completed in {} ms (success={})", jobId,
                        report.metadata().processingTimeMs(), result.success());
            }
        } catch (Exception e) {
            log.error("Resolution {} failed: {}", jobId, e.getMessage(), e);
            recordFailure(jobId, messageOf(e));
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private <T> T timed(String phase, Supplier<T> body) {
        Timer timer = Timer.builder("depscout.pipeline.phase.duration")
                .description("Duration of one resolution pipeline phase")
                .tag("phase", phase)
                .register(meterRegistry);
        long start = System.nanoTime();
        try {
            return timer.record(body);
        } finally {
            log.debug("Phase {} took {} ms", phase, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        }
    }

    private void recordFailure(UUID jobId, String error) {
        try {
            if (jobStore.fail(jobId, error)) {
                failedCounter.increment();
            }
        } catch (RuntimeException storeError) {
            log.error("Could not record failure for resolution {}: {}", jobId, storeError.getMessage(), storeError);
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
