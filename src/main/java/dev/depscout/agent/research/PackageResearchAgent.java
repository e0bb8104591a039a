package dev.depscout.agent.research;

import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.domain.valueobject.PackageResearchOutcome.LookupFailed;
import dev.depscout.domain.valueobject.PackageResearchOutcome.Researched;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.infrastructure.knowledge.DeprecationCatalog;
import dev.depscout.infrastructure.registry.PackageMetadataCache;
import dev.depscout.infrastructure.registry.PyPiRegistryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Gathers registry metadata and a deprecation verdict for a package.
 *
 * <p>Lookup order: built-in module table (no registry call), metadata cache, registry.
 * Failures are returned as {@link LookupFailed} values so one bad package never aborts
 * research for the others.
 */
@Component
public class PackageResearchAgent {

    private static final Logger log = LoggerFactory.getLogger(PackageResearchAgent.class);

    private final PyPiRegistryClient registryClient;
    private final PackageMetadataCache cache;
    private final DeprecationCatalog catalog;
    private final Optional<AiResearchAdvisor> advisor;

    public PackageResearchAgent(PyPiRegistryClient registryClient, PackageMetadataCache cache,
                                DeprecationCatalog catalog, Optional<AiResearchAdvisor> advisor) {
        this.registryClient = registryClient;
        this.cache = cache;
        this.catalog = catalog;
        this.advisor = advisor;
    }

    public PackageResearchOutcome research(String packageName) {
        String key = Requirement.keyOf(packageName);

        Optional<DeprecationAnalysis> builtin = catalog.findBuiltin(key);
        if (builtin.isPresent()) {
            log.debug("{} is a standard-library module, skipping registry", key);
            return new Researched(key, PackageMetadata.builtIn(key), builtin.get(), null);
        }

        try {
            Optional<PackageMetadata> metadata = cache.lookup(key);
            if (metadata.isPresent()) {
                log.debug("Cache hit for {}", key);
            } else {
                metadata = registryClient.fetch(key);
                if (metadata.isEmpty()) {
                    return LookupFailed.notFound(key);
                }
                cache.put(key, metadata.get());
            }

            PackageMetadata found = metadata.get();
            DeprecationAnalysis deprecation = catalog.analyze(key);
            Researched researched = new Researched(key, found, deprecation, null);
            return advisor.flatMap(a -> a.advise(found, deprecation))
                    .map(researched::withAiInsight)
                    .orElse(researched);
        } catch (RuntimeException e) {
            log.warn("Research failed for {}: {}", key, e.getMessage());
            return LookupFailed.failed(key, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Researches each distinct lowercase name once, in first-seen order.
     */
    public Map<String, PackageResearchOutcome> researchMany(Collection<String> packageNames) {
        Map<String, PackageResearchOutcome> outcomes = new LinkedHashMap<>();
        for (String name : packageNames) {
            String key = Requirement.keyOf(name);
            if (key.isEmpty() || outcomes.containsKey(key)) continue;
            outcomes.put(key, research(key));
        }
        return outcomes;
    }
}
