package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of researching one package: either registry metadata plus a deprecation verdict,
 * or an isolated lookup failure. Callers branch on the concrete type; a failure for one
 * package never prevents the others from being researched.
 */
public sealed interface PackageResearchOutcome
        permits PackageResearchOutcome.Researched, PackageResearchOutcome.LookupFailed {

    String name();

    @JsonIgnore
    default boolean isFailure() {
        return this instanceof LookupFailed;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Researched(
            String name,
            @JsonProperty("package") PackageMetadata metadata,
            DeprecationAnalysis deprecation,
            @JsonProperty("ai_insight") String aiInsight
    ) implements PackageResearchOutcome {

        public Researched withAiInsight(String insight) {
            return new Researched(name, metadata, deprecation, insight);
        }
    }

    record LookupFailed(
            String name,
            String error,
            @JsonProperty("not_found") boolean notFound
    ) implements PackageResearchOutcome {

        public static LookupFailed notFound(String name) {
            return new LookupFailed(name, "Package '%s' not found on PyPI. Check the spelling or try a different package name."
                    .formatted(name), true);
        }

        public static LookupFailed failed(String name, String message) {
            return new LookupFailed(name, "Failed to fetch package information: " + message, false);
        }
    }
}
