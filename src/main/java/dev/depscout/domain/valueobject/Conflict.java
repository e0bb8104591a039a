package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A detected inability to satisfy all requirements for a package name. The only kind the
 * resolver produces today is a name requested more than once.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Conflict(
        List<String> packages,
        String reason,
        @JsonProperty("suggested_resolution") String suggestedResolution
) {
    public static final String DUPLICATE_REASON = "Multiple requirements for the same package found";
    public static final String DUPLICATE_RESOLUTION = "Review and consolidate duplicate package requirements";

    public Conflict {
        packages = packages == null ? List.of() : List.copyOf(packages);
    }

    public static Conflict duplicateName(String name) {
        return new Conflict(List.of(name), DUPLICATE_REASON, DUPLICATE_RESOLUTION);
    }
}
