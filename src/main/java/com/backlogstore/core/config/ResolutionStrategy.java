package com.backlogstore.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the reconciler picks one snapshot when a task id exists on several branches.
 */
public enum ResolutionStrategy {
    /** Latest modification time wins. */
    MOST_RECENT("most_recent"),
    /** Highest position in the configured status list wins; time is ignored. */
    MOST_PROGRESSED("most_progressed");

    private final String wireValue;

    ResolutionStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Lenient lookup; unknown or blank values fall back to {@link #MOST_RECENT}. */
    @JsonCreator
    public static ResolutionStrategy fromValue(String value) {
        if (value == null) {
            return MOST_RECENT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ResolutionStrategy strategy : values()) {
            if (strategy.wireValue.equals(normalized)) {
                return strategy;
            }
        }
        return MOST_RECENT;
    }
}
