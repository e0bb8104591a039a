package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The validated submission a job runs against. Persisted verbatim with the job and echoed
 * back in the report as {@code original_request}.
 *
 * <p>The boolean options are recorded for consumers; resolution does not interpret them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolutionRequest(
        List<Requirement> requirements,
        @JsonProperty("python_version") String pythonVersion,
        @JsonProperty("allow_prereleases") boolean allowPrereleases,
        @JsonProperty("prefer_stable") Boolean preferStable,
        @JsonProperty("exclude_deprecated") Boolean excludeDeprecated,
        @JsonProperty("suggest_alternatives") Boolean suggestAlternatives
) {
    public static final String DEFAULT_PYTHON_VERSION = "3.9";

    public ResolutionRequest {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        if (pythonVersion == null || pythonVersion.isBlank()) pythonVersion = DEFAULT_PYTHON_VERSION;
        if (preferStable == null) preferStable = Boolean.TRUE;
        if (excludeDeprecated == null) excludeDeprecated = Boolean.TRUE;
        if (suggestAlternatives == null) suggestAlternatives = Boolean.TRUE;
    }

    public static ResolutionRequest of(List<Requirement> requirements) {
        return new ResolutionRequest(requirements, null, false, null, null, null);
    }
}
