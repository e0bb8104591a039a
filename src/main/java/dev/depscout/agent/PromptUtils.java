package dev.depscout.agent;

import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.PackageMetadata;

/**
 * Shared prompt construction utilities for AI-assisted package research.
 */
public final class PromptUtils {

    static final int MAX_SUMMARY_CHARS = 500;

    private PromptUtils() {}

    /**
     * Builds a complete prompt: base instructions + known deprecation verdict + package facts.
     */
    public static String withPackageContext(String basePrompt, PackageMetadata metadata, DeprecationAnalysis deprecation) {
        var sb = new StringBuilder(basePrompt);
        sb.append("\n\n--- KNOWN DEPRECATION ---\n")
          .append("deprecated: ").append(deprecation.deprecated()).append('\n')
          .append("reason: ").append(deprecation.reason()).append('\n');
        if (!deprecation.alternatives().isEmpty()) {
            sb.append("alternatives: ").append(String.join(", ", deprecation.alternatives())).append('\n');
        }
        sb.append("--- END KNOWN DEPRECATION ---");

        sb.append("\n\nPackage:\n")
          .append("name: ").append(metadata.name()).append('\n')
          .append("latest version: ").append(metadata.latestVersion()).append('\n')
          .append("requires python: ").append(orUnknown(metadata.requiresPython())).append('\n')
          .append("summary: ").append(truncate(orUnknown(metadata.summary()))).append('\n');
        if (!metadata.versions().isEmpty()) {
            sb.append("most recent upload: ").append(orUnknown(metadata.versions().get(0).uploadTime())).append('\n');
        }
        return sb.toString();
    }

    private static String orUnknown(String value) {
        return value == null ? "unknown" : value;
    }

    private static String truncate(String value) {
        return value.length() <= MAX_SUMMARY_CHARS ? value : value.substring(0, MAX_SUMMARY_CHARS) + "...";
    }
}
