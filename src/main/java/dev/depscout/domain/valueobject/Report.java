package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Final artifact of a completed job. Field names are part of the public contract read by
 * report consumers; do not rename.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Report(
        UUID id,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("original_request") ResolutionRequest originalRequest,
        @JsonProperty("resolution_result") ResolutionResult resolutionResult,
        @JsonProperty("manifest_text") String manifestText,
        @JsonProperty("narrative_text") String narrativeText,
        @JsonProperty("per_package_analysis") List<PackageAnalysis> perPackageAnalysis,
        Metadata metadata
) {
    public Report {
        perPackageAnalysis = perPackageAnalysis == null ? List.of() : List.copyOf(perPackageAnalysis);
    }

    public record Metadata(
            @JsonProperty("python_version") String pythonVersion,
            @JsonProperty("total_packages") int totalPackages,
            @JsonProperty("deprecated_count") int deprecatedCount,
            @JsonProperty("conflict_count") int conflictCount,
            @JsonProperty("processing_time_ms") long processingTimeMs
    ) {}
}
