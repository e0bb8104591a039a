package dev.depscout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Package registry client and metadata cache settings.
 */
@ConfigurationProperties(prefix = "depscout.registry")
public record RegistryProperties(String baseUrl, Duration responseTimeout, Duration cacheTtl, long cacheMaxSize,
                                 String userAgent) {
    public RegistryProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "https://pypi.org";
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(30);
        if (cacheTtl == null) cacheTtl = Duration.ofHours(1);
        if (cacheMaxSize <= 0) cacheMaxSize = 5_000;
        if (userAgent == null || userAgent.isBlank()) userAgent = "DepScout/0.1";
    }
}
