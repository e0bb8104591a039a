package dev.depscout.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.depscout.domain.valueobject.Requirement;

import java.util.List;

/**
 * Body of {@code POST /resolutions}. Structured {@code requirements} and free-form
 * {@code requirements_txt} may be combined; both are optional but together must be non-empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolutionSubmitRequest(
        List<Requirement> requirements,
        @JsonProperty("requirements_txt") String requirementsTxt,
        @JsonProperty("python_version") String pythonVersion,
        @JsonProperty("allow_prereleases") Boolean allowPrereleases,
        @JsonProperty("prefer_stable") Boolean preferStable,
        @JsonProperty("exclude_deprecated") Boolean excludeDeprecated,
        @JsonProperty("suggest_alternatives") Boolean suggestAlternatives
) {
    public static ResolutionSubmitRequest of(List<Requirement> requirements) {
        return new ResolutionSubmitRequest(requirements, null, null, null, null, null, null);
    }
}
