package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Static/heuristic deprecation verdict for one package. Confidence is clamped to [0, 1].
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeprecationAnalysis(
        @JsonProperty("is_deprecated") boolean deprecated,
        double confidence,
        List<String> evidence,
        List<String> alternatives,
        String reason,
        String warning
) {
    public DeprecationAnalysis {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    public static DeprecationAnalysis notDeprecated() {
        return new DeprecationAnalysis(false, 0.0, List.of(), List.of(),
                "Package not in known deprecated packages list", null);
    }

    public Optional<String> firstAlternative() {
        return alternatives.stream().findFirst();
    }
}
