package dev.depscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Background pipeline sizing. {@code deadline} bounds how long a job may stay in processing
 * before the watchdog marks it failed.
 */
@ConfigurationProperties(prefix = "depscout.pipeline")
public record PipelineProperties(Duration deadline, int corePoolSize, int maxPoolSize, int queueCapacity) {
    public PipelineProperties {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) deadline = Duration.ofMinutes(5);
        if (corePoolSize <= 0) corePoolSize = 2;
        if (maxPoolSize < corePoolSize) maxPoolSize = Math.max(8, corePoolSize);
        if (queueCapacity < 0) queueCapacity = 100;
    }
}
