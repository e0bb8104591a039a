package dev.depscout.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.depscout.exception.SubmissionValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One named-package version constraint as submitted by the caller.
 *
 * <p>Identity is the lowercase name ({@link #key()}); {@link #name()} keeps the caller's casing
 * for display. {@code originalSpec} is never empty: when the caller omits it, it is rebuilt
 * from name, operator and version.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Requirement(
        String name,
        String operator,
        String version,
        boolean fixed,
        @JsonProperty("original_spec") String originalSpec
) {

    public static final Set<String> OPERATORS = Set.of("", "==", ">=", ">", "<=", "<", "!=", "~=", "===");

    private static final Pattern CONSTRAINED =
            Pattern.compile("^([A-Za-z0-9\\-_.]+)\\s*(===|==|>=|<=|!=|~=|>|<)\\s*([^,\\s;]+).*$");
    private static final Pattern BARE = Pattern.compile("^([A-Za-z0-9\\-_.]+)\\s*(?:;.*)?$");

    public Requirement {
        if (operator == null) operator = "";
        if (version != null && version.isBlank()) version = null;
        fixed = fixed || "==".equals(operator);
        if (originalSpec == null || originalSpec.isBlank()) {
            originalSpec = (name == null ? "" : name.trim()) + operator + (version == null ? "" : version);
        }
    }

    public static Requirement of(String name, String operator, String version) {
        return new Requirement(name, operator, version, false, null);
    }

    /** Lowercase identity used for caching, research lookups and duplicate detection. */
    @JsonIgnore
    public String key() {
        return keyOf(name);
    }

    public static String keyOf(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a single requirement line such as {@code numpy>=1.19.0,<2.0} or {@code django==3.2.5}.
     * Only the first clause of a comma-separated specifier is kept, matching the resolver's
     * single-operator model.
     */
    public static Requirement parse(String line) {
        String spec = line == null ? "" : line.trim();
        Matcher constrained = CONSTRAINED.matcher(spec);
        if (constrained.matches()) {
            return new Requirement(constrained.group(1).toLowerCase(Locale.ROOT),
                    constrained.group(2), constrained.group(3), false, spec);
        }
        Matcher bare = BARE.matcher(spec);
        if (bare.matches()) {
            return new Requirement(bare.group(1).toLowerCase(Locale.ROOT), "", null, false, spec);
        }
        throw new SubmissionValidationException("Invalid requirement format: " + line);
    }

    /**
     * Parses requirements.txt content. Blank lines, comments and pip option lines
     * ({@code -r}, {@code -e}, {@code --index-url} ...) are skipped.
     */
    public static List<Requirement> parseAll(String text) {
        List<Requirement> parsed = new ArrayList<>();
        if (text == null) return parsed;
        for (String raw : text.split("\\R")) {
            String line = stripComment(raw).trim();
            if (line.isEmpty() || line.startsWith("-")) continue;
            parsed.add(parse(line));
        }
        return parsed;
    }

    private static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash >= 0 ? line.substring(0, hash) : line;
    }
}
