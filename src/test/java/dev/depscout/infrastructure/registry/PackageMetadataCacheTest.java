package dev.depscout.infrastructure.registry;

import com.github.benmanes.caffeine.cache.Ticker;
import dev.depscout.config.RegistryProperties;
import dev.depscout.domain.valueobject.PackageMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class PackageMetadataCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private PackageMetadataCache cache;

    @BeforeEach
    void setUp() {
        RegistryProperties props = new RegistryProperties(null, null, Duration.ofHours(1), 100, null);
        Ticker ticker = nanos::get;
        cache = new PackageMetadataCache(props, ticker);
    }

    @Test
    @DisplayName("entries are served until the TTL elapses")
    void expiresAfterTtl() {
        cache.put("numpy", metadata("1.24.3"));

        nanos.addAndGet(Duration.ofMinutes(59).toNanos());
        assertThat(cache.lookup("numpy")).map(PackageMetadata::latestVersion).contains("1.24.3");

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(cache.lookup("numpy")).isEmpty();
    }

    @Test
    @DisplayName("entries without a latest version are evicted on read")
    void evictsMalformedEntry() {
        cache.put("broken", metadata(" "));

        assertThat(cache.lookup("broken")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    private static PackageMetadata metadata(String latest) {
        return new PackageMetadata("pkg", null, null, null, latest, null, List.of(), null, null);
    }
}
