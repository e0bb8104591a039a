package dev.depscout.service;

import dev.depscout.domain.entity.ResolutionJob;
import dev.depscout.domain.event.ResolutionRequestedEvent;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.dto.request.ResolutionSubmitRequest;
import dev.depscout.exception.SubmissionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Command-side service. Validates a submission, records the job in PROCESSING and publishes
 * a domain event that starts the pipeline after commit.
 */
@Service
public class ResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ResolutionService.class);
    private final ResolutionJobStore jobStore;
    private final ApplicationEventPublisher eventPublisher;

    public ResolutionService(ResolutionJobStore jobStore, ApplicationEventPublisher eventPublisher) {
        this.jobStore = jobStore;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public UUID submit(ResolutionSubmitRequest submission) {
        ResolutionRequest request = toRequest(submission);
        ResolutionJob job = jobStore.create(request);
        eventPublisher.publishEvent(new ResolutionRequestedEvent(job.getId(), request, job.getCreatedAt()));
        log.info("Created resolution {} for {} requirements", job.getId(), request.requirements().size());
        return job.getId();
    }

    static ResolutionRequest toRequest(ResolutionSubmitRequest submission) {
        if (submission == null) {
            throw new SubmissionValidationException("Request body is required");
        }
        List<Requirement> requirements = new ArrayList<>();
        if (submission.requirements() != null) {
            requirements.addAll(submission.requirements());
        }
        requirements.addAll(Requirement.parseAll(submission.requirementsTxt()));
        validate(requirements);
        return new ResolutionRequest(requirements, submission.pythonVersion(),
                Boolean.TRUE.equals(submission.allowPrereleases()), submission.preferStable(),
                submission.excludeDeprecated(), submission.suggestAlternatives());
    }

    private static void validate(List<Requirement> requirements) {
        if (requirements.isEmpty()) {
            throw new SubmissionValidationException("Invalid request. Please provide at least one requirement.");
        }
        for (int i = 0; i < requirements.size(); i++) {
            Requirement req = requirements.get(i);
            if (req == null || req.name() == null || req.name().isBlank()) {
                throw new SubmissionValidationException("Requirement #%d has an empty package name".formatted(i + 1));
            }
            if (!Requirement.OPERATORS.contains(req.operator())) {
                throw new SubmissionValidationException("Requirement '%s' has unsupported operator '%s'"
                        .formatted(req.name(), req.operator()));
            }
        }
    }
}
