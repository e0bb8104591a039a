package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeprecatedPackageEntry(
        String name,
        String version,
        String reason,
        @JsonProperty("suggested_alternative") String suggestedAlternative
) {}
