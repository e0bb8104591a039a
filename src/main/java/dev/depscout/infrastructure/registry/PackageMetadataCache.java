package dev.depscout.infrastructure.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.depscout.config.RegistryProperties;
import dev.depscout.domain.valueobject.PackageMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Process-wide registry metadata cache keyed by lowercase package name.
 * Entries expire {@code depscout.registry.cache-ttl} after they were written.
 *
 * <p>Last writer wins. Two jobs missing on the same name at once both fetch upstream; the
 * duplicate call is harmless.
 */
@Component
public class PackageMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(PackageMetadataCache.class);

    private final Cache<String, PackageMetadata> cache;

    @Autowired
    public PackageMetadataCache(RegistryProperties props) {
        this(props, Ticker.systemTicker());
    }

    PackageMetadataCache(RegistryProperties props, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(props.cacheMaxSize())
                .expireAfterWrite(props.cacheTtl())
                .ticker(ticker)
                .build();
    }

    /**
     * Returns a usable entry. An entry without a latest version is treated as corrupt:
     * it is evicted and reported as a miss.
     */
    public Optional<PackageMetadata> lookup(String key) {
        PackageMetadata cached = cache.getIfPresent(key);
        if (cached == null) return Optional.empty();
        if (!cached.hasLatestVersion()) {
            log.warn("Evicting malformed cache entry for {}", key);
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    public void put(String key, PackageMetadata metadata) {
        cache.put(key, metadata);
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
