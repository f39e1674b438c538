package com.backlogstore.core.store;

import java.util.List;

/**
 * Outcome of removing an archived id from other tasks.
 *
 * @param updated    ids of tasks whose dependencies or references were rewritten
 * @param conflicted ids of tasks that changed underneath the sanitizer and were left alone
 */
public record SanitizeResult(List<String> updated, List<String> conflicted) {

    public SanitizeResult {
        updated = List.copyOf(updated);
        conflicted = List.copyOf(conflicted);
    }

    public static SanitizeResult empty() {
        return new SanitizeResult(List.of(), List.of());
    }
}
