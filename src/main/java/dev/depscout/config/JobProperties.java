package dev.depscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "depscout.jobs")
public record JobProperties(Duration retention) {
    public JobProperties {
        if (retention == null || retention.isNegative() || retention.isZero()) retention = Duration.ofDays(7);
    }
}
