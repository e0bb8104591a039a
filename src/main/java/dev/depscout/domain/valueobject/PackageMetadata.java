package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Registry metadata for one package. {@code source} is {@value #SOURCE_PYPI} for registry data
 * and {@value #SOURCE_BUILT_IN} for standard-library modules that are never looked up.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PackageMetadata(
        String name,
        String summary,
        String author,
        String license,
        @JsonProperty("latest_version") String latestVersion,
        @JsonProperty("requires_python") String requiresPython,
        List<ReleaseVersion> versions,
        @JsonProperty("package_url") String packageUrl,
        String source
) {
    public static final String SOURCE_PYPI = "pypi";
    public static final String SOURCE_BUILT_IN = "built-in";
    public static final String BUILT_IN_VERSION = "built-in";

    public PackageMetadata {
        versions = versions == null ? List.of() : List.copyOf(versions);
        if (source == null) source = SOURCE_PYPI;
    }

    public static PackageMetadata builtIn(String name) {
        return new PackageMetadata(name, "Python standard-library module", "Python Software Foundation",
                "PSF", BUILT_IN_VERSION, null, List.of(), null, SOURCE_BUILT_IN);
    }

    @JsonIgnore
    public boolean hasLatestVersion() {
        return latestVersion != null && !latestVersion.isBlank();
    }

    @JsonIgnore
    public boolean isBuiltIn() {
        return SOURCE_BUILT_IN.equals(source);
    }

    public record ReleaseVersion(
            String version,
            @JsonProperty("upload_time") String uploadTime,
            boolean yanked,
            @JsonProperty("yanked_reason") String yankedReason
    ) {}
}
