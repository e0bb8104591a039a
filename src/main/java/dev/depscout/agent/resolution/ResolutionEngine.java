package dev.depscout.agent.resolution;

import dev.depscout.domain.valueobject.Conflict;
import dev.depscout.domain.valueobject.DeprecatedPackageEntry;
import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.domain.valueobject.PackageResearchOutcome.LookupFailed;
import dev.depscout.domain.valueobject.PackageResearchOutcome.Researched;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionResult;
import dev.depscout.domain.valueobject.ResolvedPackage;
import dev.depscout.infrastructure.knowledge.DeprecationCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns one version per requested package name from pre-gathered research.
 *
 * <p>Single pass, input order, no backtracking and no transitive graph. The only conflict it
 * detects is the same name (case-insensitive) requested more than once. For {@code >=} and
 * {@code >} the registry's latest version is taken without checking it against the bound.
 */
@Component
public class ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    static final String UNKNOWN_VERSION = "unknown";

    private final DeprecationCatalog catalog;

    public ResolutionEngine(DeprecationCatalog catalog) {
        this.catalog = catalog;
    }

    public ResolutionResult resolve(List<Requirement> requirements, Map<String, PackageResearchOutcome> research) {
        Map<String, ResolvedPackage> resolved = new LinkedHashMap<>();
        List<DeprecatedPackageEntry> deprecated = new ArrayList<>();
        Set<String> duplicated = new LinkedHashSet<>();
        List<Conflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Requirement req : requirements) {
            String displayName = req.name() == null ? "" : req.name().trim();
            if (displayName.isEmpty()) {
                warnings.add("Empty package name provided: '%s'".formatted(req.name() == null ? "" : req.name()));
                continue;
            }
            String key = req.key();

            ResolvedPackage previous = resolved.get(key);
            if (previous != null) {
                if (duplicated.add(key)) {
                    conflicts.add(Conflict.duplicateName(previous.name()));
                }
                continue;
            }

            Optional<DeprecationAnalysis> builtin = catalog.findBuiltin(key);
            if (builtin.isPresent()) {
                resolved.put(key, new ResolvedPackage(displayName, PackageMetadata.BUILT_IN_VERSION));
                deprecated.add(new DeprecatedPackageEntry(displayName, PackageMetadata.BUILT_IN_VERSION,
                        builtin.get().reason(), builtin.get().firstAlternative().orElse(null)));
                continue;
            }

            PackageResearchOutcome outcome = research.get(key);
            if (!(outcome instanceof Researched researched)) {
                String error = outcome instanceof LookupFailed failed ? failed.error() : "no research result";
                warnings.add("Could not find package '%s': %s".formatted(displayName, error));
                continue;
            }

            String version = chooseVersion(req, researched.metadata());
            resolved.put(key, new ResolvedPackage(displayName, version));

            DeprecationAnalysis deprecation = researched.deprecation();
            if (deprecation != null && deprecation.deprecated()) {
                String reason = deprecation.reason() != null ? deprecation.reason() : "Package is deprecated";
                deprecated.add(new DeprecatedPackageEntry(displayName, version, reason,
                        deprecation.firstAlternative().orElse(null)));
            }
        }

        ResolutionResult result = ResolutionResult.of(List.copyOf(resolved.values()), deprecated, conflicts, warnings);
        log.info("Resolved {} packages ({} deprecated, {} conflicts, {} warnings)",
                result.resolvedPackages().size(), deprecated.size(), conflicts.size(), warnings.size());
        return result;
    }

    static String chooseVersion(Requirement req, PackageMetadata metadata) {
        String latest = metadata != null && metadata.hasLatestVersion() ? metadata.latestVersion() : null;
        String requested = req.version();
        String operator = req.operator();

        if (requested != null && ("==".equals(operator) || req.fixed())) {
            return requested;
        }
        if (">=".equals(operator) || ">".equals(operator)) {
            if (latest != null) return latest;
            return requested != null ? requested : UNKNOWN_VERSION;
        }
        return latest != null ? latest : UNKNOWN_VERSION;
    }
}
