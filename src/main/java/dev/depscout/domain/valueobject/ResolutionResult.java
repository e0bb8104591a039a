package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the resolution phase.
 *
 * <p>{@code success} holds iff there are no conflicts and at least one package was resolved
 * or flagged deprecated; {@link #of} derives both {@code success} and {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolutionResult(
        boolean success,
        @JsonProperty("resolved_packages") List<ResolvedPackage> resolvedPackages,
        @JsonProperty("deprecated_packages") List<DeprecatedPackageEntry> deprecatedPackages,
        List<Conflict> conflicts,
        List<String> warnings,
        String error
) {
    public ResolutionResult {
        resolvedPackages = resolvedPackages == null ? List.of() : List.copyOf(resolvedPackages);
        deprecatedPackages = deprecatedPackages == null ? List.of() : List.copyOf(deprecatedPackages);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ResolutionResult of(List<ResolvedPackage> resolved, List<DeprecatedPackageEntry> deprecated,
                                      List<Conflict> conflicts, List<String> warnings) {
        boolean hasConflicts = !conflicts.isEmpty();
        boolean hasUsefulResults = !resolved.isEmpty() || !deprecated.isEmpty();
        boolean success = !hasConflicts && hasUsefulResults;

        String error = null;
        if (hasConflicts) {
            error = "Found %d conflicts".formatted(conflicts.size());
        } else if (!hasUsefulResults) {
            error = "No packages could be resolved";
        }
        return new ResolutionResult(success, resolved, deprecated, conflicts, warnings, error);
    }
}
