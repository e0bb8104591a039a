package dev.depscout.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Deletes jobs past their retention window. */
@Component
public class JobRetentionSweeper {
    private static final Logger log = LoggerFactory.getLogger(JobRetentionSweeper.class);
    private final ResolutionJobStore jobStore;

    public JobRetentionSweeper(ResolutionJobStore jobStore) { this.jobStore = jobStore; }

    @Scheduled(fixedDelayString = "${depscout.jobs.sweep-interval-ms:3600000}",
               initialDelayString = "${depscout.jobs.sweep-initial-delay-ms:60000}")
    public void sweep() {
        try {
            long purged = jobStore.purgeExpired();
            if (purged > 0) log.info("Purged {} expired resolution jobs", purged);
        } catch (RuntimeException e) {
            log.warn("Retention sweep failed, will retry next cycle: {}", e.getMessage());
        }
    }
}
