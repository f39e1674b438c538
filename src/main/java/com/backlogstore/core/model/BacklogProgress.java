package com.backlogstore.core.model;

import java.util.Map;

/**
 * Counts of active tasks per status; the last configured status counts as done.
 */
public record BacklogProgress(int total, int done, Map<String, Integer> byStatus) {

    public int percentDone() {
        return total == 0 ? 0 : Math.round(done * 100f / total);
    }
}
