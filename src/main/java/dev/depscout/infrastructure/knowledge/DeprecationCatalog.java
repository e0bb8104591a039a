package dev.depscout.infrastructure.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.Requirement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known-deprecation knowledge, loaded once at startup from a versioned JSON resource.
 *
 * <p>Two tables: {@code packages} (published packages, consulted after a registry lookup) and
 * {@code builtins} (standard-library modules that are never looked up on the registry).
 * Both are immutable after construction.
 */
@Component
public class DeprecationCatalog {

    private static final Logger log = LoggerFactory.getLogger(DeprecationCatalog.class);

    static final String BUILT_IN_EVIDENCE = "Deprecated standard-library module";

    private final String version;
    private final Map<String, PackageEntry> packages;
    private final Map<String, BuiltinEntry> builtins;

    public DeprecationCatalog(@Value("${depscout.deprecations.location:classpath:deprecations/known-deprecations.json}")
                              Resource location, ObjectMapper objectMapper) {
        CatalogFile file;
        try (InputStream in = location.getInputStream()) {
            file = objectMapper.readValue(in, CatalogFile.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load deprecation catalog from " + location, e);
        }
        this.version = file.version() == null ? "unversioned" : file.version();
        this.packages = file.packages() == null ? Map.of() : Map.copyOf(file.packages());
        this.builtins = file.builtins() == null ? Map.of() : Map.copyOf(file.builtins());
        log.info("Loaded deprecation catalog version {} ({} packages, {} built-in modules)",
                version, packages.size(), builtins.size());
    }

    public String version() {
        return version;
    }

    /** Deprecation verdict for a standard-library module, if the name is one. */
    public Optional<DeprecationAnalysis> findBuiltin(String name) {
        BuiltinEntry entry = builtins.get(Requirement.keyOf(name));
        if (entry == null) return Optional.empty();
        return Optional.of(new DeprecationAnalysis(true, entry.confidence(), List.of(BUILT_IN_EVIDENCE),
                entry.alternatives(), entry.reason(), null));
    }

    /**
     * Verdict for a published package. Entries marked not deprecated but carrying a warning
     * (e.g. old setuptools) are reported as "problematic".
     */
    public DeprecationAnalysis analyze(String name) {
        PackageEntry entry = packages.get(Requirement.keyOf(name));
        if (entry == null) return DeprecationAnalysis.notDeprecated();
        String evidence = "Known %s package in database".formatted(entry.deprecated() ? "deprecated" : "problematic");
        return new DeprecationAnalysis(entry.deprecated(), entry.confidence(), List.of(evidence),
                entry.alternatives(), entry.reason(), entry.warning());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogFile(String version, Map<String, PackageEntry> packages, Map<String, BuiltinEntry> builtins) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PackageEntry(boolean deprecated, String reason, List<String> alternatives, double confidence,
                        @JsonProperty("last_release") String lastRelease, String warning) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BuiltinEntry(String reason, List<String> alternatives, double confidence) {}
}
