package dev.depscout.agent.report;

import dev.depscout.domain.valueobject.Conflict;
import dev.depscout.domain.valueobject.DeprecatedPackageEntry;
import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.PackageAnalysis;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.domain.valueobject.PackageResearchOutcome.LookupFailed;
import dev.depscout.domain.valueobject.PackageResearchOutcome.Researched;
import dev.depscout.domain.valueobject.Report;
import dev.depscout.domain.valueobject.Requirement;
import dev.depscout.domain.valueobject.ResolutionRequest;
import dev.depscout.domain.valueobject.ResolutionResult;
import dev.depscout.domain.valueobject.ResolvedPackage;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a resolution result and its research into the final {@link Report}: a pinned
 * requirements manifest, a Markdown narrative and one analysis line per researched package.
 */
@Component
public class ReportCompiler {

    private final Clock clock;

    public ReportCompiler(Clock clock) {
        this.clock = clock;
    }

    public Report compile(UUID jobId, ResolutionRequest request, ResolutionResult result,
                          Map<String, PackageResearchOutcome> research, Instant startTime) {
        Instant now = clock.instant();
        String manifest = buildManifest(result.resolvedPackages(), research, now);
        String narrative = buildNarrative(request, result, now);
        List<PackageAnalysis> analyses = buildAnalyses(result, research);

        long processingMs = Math.max(0, Duration.between(startTime, now).toMillis());
        Report.Metadata metadata = new Report.Metadata(
                request.pythonVersion(),
                request.requirements().size(),
                result.deprecatedPackages().size(),
                result.conflicts().size(),
                processingMs);

        return new Report(jobId, now, request, result, manifest, narrative, analyses, metadata);
    }

    // ── Manifest ───────────────────────────────────────────────────

    static String buildManifest(List<ResolvedPackage> packages, Map<String, PackageResearchOutcome> research,
                                Instant generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Python Requirements File\n");
        sb.append("# Generated on: ").append(generatedAt).append('\n');
        sb.append("# Total packages: ").append(packages.size()).append('\n');
        sb.append("#\n");
        sb.append("# Install with: pip install -r requirements.txt\n");
        sb.append("#\n\n");

        List<ResolvedPackage> sorted = new ArrayList<>(packages);
        sorted.sort(Comparator.comparing(ResolvedPackage::name, String.CASE_INSENSITIVE_ORDER));
        for (ResolvedPackage pkg : sorted) {
            sb.append(pkg.name()).append("==").append(pkg.version());
            String source = sourceOf(pkg, research);
            if (!PackageMetadata.SOURCE_PYPI.equals(source)) {
                sb.append("  # ").append(source);
            }
            sb.append('\n');
        }

        if (!sorted.isEmpty()) {
            sb.append("\n# End of requirements\n");
        }
        return sb.toString();
    }

    private static String sourceOf(ResolvedPackage pkg, Map<String, PackageResearchOutcome> research) {
        if (research.get(Requirement.keyOf(pkg.name())) instanceof Researched researched) {
            return researched.metadata().source();
        }
        return PackageMetadata.BUILT_IN_VERSION.equals(pkg.version())
                ? PackageMetadata.SOURCE_BUILT_IN : PackageMetadata.SOURCE_PYPI;
    }

    // ── Narrative ──────────────────────────────────────────────────

    static String buildNarrative(ResolutionRequest request, ResolutionResult result, Instant generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Python Dependency Resolution Report\n\n");
        sb.append("**Generated:** ").append(generatedAt).append('\n');
        sb.append("**Python Version:** ").append(request.pythonVersion()).append('\n');
        sb.append("**Total Packages:** ").append(request.requirements().size()).append("\n\n");

        sb.append("## Summary\n\n");
        sb.append("**Resolution Status:** ").append(result.success() ? "Successful" : "Failed").append('\n');
        sb.append("**Conflicts:** ").append(result.conflicts().size()).append('\n');
        sb.append("**Deprecated Packages:** ").append(result.deprecatedPackages().size()).append("\n\n");

        if (!result.resolvedPackages().isEmpty()) {
            sb.append("## Resolved Packages\n\n");
            for (ResolvedPackage pkg : result.resolvedPackages()) {
                sb.append("- **").append(pkg.name()).append("** ").append(pkg.version()).append('\n');
            }
            sb.append('\n');
        }

        if (!result.deprecatedPackages().isEmpty()) {
            sb.append("## Deprecated Packages\n\n");
            for (DeprecatedPackageEntry dep : result.deprecatedPackages()) {
                sb.append("### ").append(dep.name()).append('\n');
                sb.append("- **Version:** ").append(dep.version()).append('\n');
                sb.append("- **Reason:** ").append(dep.reason()).append('\n');
                if (dep.suggestedAlternative() != null) {
                    sb.append("- **Suggested Alternative:** ").append(dep.suggestedAlternative()).append('\n');
                }
                sb.append('\n');
            }
        }

        if (!result.conflicts().isEmpty()) {
            sb.append("## Conflicts\n\n");
            for (Conflict conflict : result.conflicts()) {
                sb.append("### ").append(String.join(", ", conflict.packages())).append('\n');
                sb.append("- **Reason:** ").append(conflict.reason()).append('\n');
                if (conflict.suggestedResolution() != null) {
                    sb.append("- **Suggested Resolution:** ").append(conflict.suggestedResolution()).append('\n');
                }
                sb.append('\n');
            }
        }

        if (!result.warnings().isEmpty()) {
            sb.append("## Warnings\n\n");
            result.warnings().forEach(w -> sb.append("- ").append(w).append('\n'));
            sb.append('\n');
        }
        return sb.toString();
    }

    // ── Per-package analysis ───────────────────────────────────────

    static List<PackageAnalysis> buildAnalyses(ResolutionResult result, Map<String, PackageResearchOutcome> research) {
        Map<String, String> resolvedVersions = new HashMap<>();
        result.resolvedPackages().forEach(p -> resolvedVersions.put(Requirement.keyOf(p.name()), p.version()));

        List<PackageAnalysis> analyses = new ArrayList<>();
        for (Map.Entry<String, PackageResearchOutcome> entry : research.entrySet()) {
            PackageResearchOutcome outcome = entry.getValue();
            String current = outcome instanceof Researched r && r.metadata().hasLatestVersion()
                    ? r.metadata().latestVersion() : "unknown";
            String recommended = resolvedVersions.getOrDefault(entry.getKey(), "unresolved");
            analyses.add(new PackageAnalysis(outcome.name(), current, recommended, describe(outcome)));
        }
        return analyses;
    }

    public static String describe(PackageResearchOutcome outcome) {
        if (outcome instanceof LookupFailed failed) {
            return "Error: " + failed.error();
        }
        Researched researched = (Researched) outcome;
        StringBuilder sb = new StringBuilder();
        PackageMetadata metadata = researched.metadata();
        if (metadata.isBuiltIn()) {
            sb.append("Standard-library module, not published on PyPI. ");
        } else if (!metadata.versions().isEmpty()) {
            sb.append("PyPI package with ").append(metadata.versions().size()).append(" versions. ");
        }

        DeprecationAnalysis deprecation = researched.deprecation();
        if (deprecation != null && deprecation.deprecated()) {
            sb.append("DEPRECATED (confidence: ").append(Math.round(deprecation.confidence() * 100)).append("%). ");
            if (!deprecation.alternatives().isEmpty()) {
                sb.append("Consider: ").append(String.join(", ", deprecation.alternatives())).append(". ");
            }
        }
        if (deprecation != null && deprecation.warning() != null) {
            sb.append(deprecation.warning()).append(". ");
        }
        if (researched.aiInsight() != null) {
            sb.append("AI insight: ").append(researched.aiInsight());
        }

        String text = sb.toString().trim();
        return text.isEmpty() ? "No specific issues found." : text;
    }
}
