package dev.depscout.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.depscout.domain.valueobject.PackageResearchOutcome;

public record ResearchResponse(
        @JsonProperty("package") String packageName,
        PackageResearchOutcome research,
        String analysis
) {}
