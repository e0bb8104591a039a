package dev.depscout.agent.research;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.depscout.config.RegistryProperties;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.domain.valueobject.PackageResearchOutcome.LookupFailed;
import dev.depscout.domain.valueobject.PackageResearchOutcome.Researched;
import dev.depscout.exception.PackageLookupException;
import dev.depscout.infrastructure.knowledge.DeprecationCatalog;
import dev.depscout.infrastructure.registry.PackageMetadataCache;
import dev.depscout.infrastructure.registry.PyPiRegistryClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PackageResearchAgentTest {

    private PyPiRegistryClient registryClient;
    private PackageMetadataCache cache;
    private DeprecationCatalog catalog;
    private PackageResearchAgent agent;

    @BeforeEach
    void setUp() {
        registryClient = mock(PyPiRegistryClient.class);
        cache = new PackageMetadataCache(new RegistryProperties(null, null, null, 0, null));
        catalog = new DeprecationCatalog(new ClassPathResource("deprecations/known-deprecations.json"), new ObjectMapper());
        agent = new PackageResearchAgent(registryClient, cache, catalog, Optional.empty());
    }

    @Test
    @DisplayName("built-in modules never hit the registry")
    void builtinSkipsRegistry() {
        PackageResearchOutcome outcome = agent.research("imp");

        assertThat(outcome).isInstanceOfSatisfying(Researched.class, r -> {
            assertThat(r.metadata().isBuiltIn()).isTrue();
            assertThat(r.metadata().latestVersion()).isEqualTo("built-in");
            assertThat(r.deprecation().deprecated()).isTrue();
        });
        verify(registryClient, never()).fetch(anyString());
    }

    @Test
    @DisplayName("registry hits are cached under the lowercase name")
    void cachesSuccessfulLookups() {
        when(registryClient.fetch("nose")).thenReturn(Optional.of(metadata("nose", "1.3.7")));

        PackageResearchOutcome first = agent.research("Nose");
        PackageResearchOutcome second = agent.research("nose");

        assertThat(first).isInstanceOfSatisfying(Researched.class, r -> {
            assertThat(r.name()).isEqualTo("nose");
            assertThat(r.deprecation().deprecated()).isTrue();
            assertThat(r.deprecation().confidence()).isEqualTo(0.95);
        });
        assertThat(second).isEqualTo(first);
        verify(registryClient, times(1)).fetch("nose");
    }

    @Test
    @DisplayName("a malformed cache entry is refetched")
    void refetchesMalformedCacheEntry() {
        cache.put("numpy", metadata("numpy", null));
        when(registryClient.fetch("numpy")).thenReturn(Optional.of(metadata("numpy", "1.24.3")));

        PackageResearchOutcome outcome = agent.research("numpy");

        assertThat(outcome).isInstanceOfSatisfying(Researched.class,
                r -> assertThat(r.metadata().latestVersion()).isEqualTo("1.24.3"));
    }

    @Test
    @DisplayName("unknown packages become not-found failures")
    void notFound() {
        when(registryClient.fetch("nonexistent-package-xyz")).thenReturn(Optional.empty());

        PackageResearchOutcome outcome = agent.research("nonexistent-package-xyz");

        assertThat(outcome).isInstanceOfSatisfying(LookupFailed.class, f -> {
            assertThat(f.notFound()).isTrue();
            assertThat(f.error()).contains("not found on PyPI");
        });
    }

    @Test
    @DisplayName("registry errors are isolated per package")
    void failuresAreIsolated() {
        when(registryClient.fetch("flaky")).thenThrow(new PackageLookupException("flaky", "503 Service Unavailable", null));
        when(registryClient.fetch("numpy")).thenReturn(Optional.of(metadata("numpy", "1.24.3")));

        Map<String, PackageResearchOutcome> outcomes = agent.researchMany(List.of("flaky", "numpy"));

        assertThat(outcomes.get("flaky")).isInstanceOfSatisfying(LookupFailed.class, f -> {
            assertThat(f.notFound()).isFalse();
            assertThat(f.error()).isEqualTo("Failed to fetch package information: 503 Service Unavailable");
        });
        assertThat(outcomes.get("numpy")).isInstanceOf(Researched.class);
    }

    @Test
    @DisplayName("researchMany visits each distinct name once, in first-seen order")
    void researchManyDeduplicates() {
        when(registryClient.fetch(any())).thenAnswer(inv -> Optional.of(metadata(inv.getArgument(0), "1.0")));

        Map<String, PackageResearchOutcome> outcomes = agent.researchMany(List.of("Django", "requests", "django", " "));

        assertThat(outcomes).containsOnlyKeys("django", "requests");
        assertThat(outcomes.keySet()).containsExactly("django", "requests");
        verify(registryClient, times(1)).fetch("django");
    }

    @Test
    @DisplayName("AI insight is attached without changing the verdict")
    void attachesAiInsight() {
        AiResearchAdvisor advisor = mock(AiResearchAdvisor.class);
        when(advisor.advise(any(), any())).thenReturn(Optional.of("Unmaintained since 2015."));
        when(registryClient.fetch("nose")).thenReturn(Optional.of(metadata("nose", "1.3.7")));
        agent = new PackageResearchAgent(registryClient, cache, catalog, Optional.of(advisor));

        PackageResearchOutcome outcome = agent.research("nose");

        assertThat(outcome).isInstanceOfSatisfying(Researched.class, r -> {
            assertThat(r.aiInsight()).isEqualTo("Unmaintained since 2015.");
            assertThat(r.deprecation().deprecated()).isTrue();
        });
    }

    private static PackageMetadata metadata(String name, String latest) {
        return new PackageMetadata(name, null, null, null, latest, null,
                List.of(new PackageMetadata.ReleaseVersion(latest, "2023-01-01T00:00:00", false, null)), null, null);
    }
}
