package dev.depscout.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle: PROCESSING → COMPLETED | FAILED. Terminal states never revert.
 */
public enum JobStatus {
    PROCESSING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
