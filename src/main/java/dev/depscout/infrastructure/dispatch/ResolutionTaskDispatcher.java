package dev.depscout.infrastructure.dispatch;

import dev.depscout.agent.orchestrator.ResolutionOrchestrator;
import dev.depscout.domain.event.ResolutionRequestedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts the background pipeline once the job row is committed.
 *
 * <p>
 * Flow:
 *
 * <pre>
 * POST /resolutions → ResolutionService → ApplicationEvent → [commit] → THIS → Orchestrator (executor)
 * </pre>
 *
 * <p>
 * Listening after commit means the pipeline can never race ahead of the row it updates. If
 * the submitting transaction rolls back, no pipeline is started and the caller gets the error.
 */
@Component
public class ResolutionTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ResolutionTaskDispatcher.class);

    private final ResolutionOrchestrator orchestrator;

    public ResolutionTaskDispatcher(ResolutionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @TransactionalEventListener
    public void onResolutionRequested(ResolutionRequestedEvent event) {
        log.debug("Dispatching resolution {}", event.jobId());
        orchestrator.launch(event.jobId(), event.request(), event.submittedAt());
    }
}
