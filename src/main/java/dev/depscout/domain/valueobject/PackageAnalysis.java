package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PackageAnalysis(
        String name,
        @JsonProperty("current_version") String currentVersion,
        @JsonProperty("recommended_version") String recommendedVersion,
        String analysis
) {}
