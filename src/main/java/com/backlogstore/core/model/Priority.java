package com.backlogstore.core.model;

import java.util.Locale;

/**
 * Task priority as written in the {@code priority} header field.
 */
public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireValue;

    Priority(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Case-insensitive lookup. Returns {@code null} for blank or unknown values.
     */
    public static Priority parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        for (Priority p : values()) {
            if (lower.contains(p.wireValue)) {
                return p;
            }
        }
        return null;
    }
}
