package com.backlogstore.core.reconcile;

import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.config.ResolutionStrategy;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskSource;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Picks one snapshot out of the copies of a task found on different branches.
 *
 * <p>{@code most_recent} takes the latest modification time;
 * {@code most_progressed} takes the status furthest along the configured
 * list, with Draft and unknown statuses lowest, and ignores time. Ties go to
 * the working-tree copy, then to the branch whose name sorts first, so the
 * same inputs always resolve to the same snapshot.
 */
public final class ResolutionPolicy {

    static final Comparator<Task> TIE_BREAK = Comparator
            .comparing((Task task) -> task.source() == TaskSource.LOCAL ? 0 : 1)
            .thenComparing(task -> task.branch() == null ? "" : task.branch());

    private ResolutionPolicy() {
    }

    public static Task resolve(List<Task> candidates, ResolutionStrategy strategy, List<String> statuses) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Nothing to resolve");
        }
        Comparator<Task> preference = switch (strategy) {
            case MOST_RECENT -> Comparator.comparing(ResolutionPolicy::modified).reversed();
            case MOST_PROGRESSED -> Comparator.comparingInt((Task task) -> statusRank(task.status(), statuses)).reversed();
        };
        return candidates.stream().min(preference.thenComparing(TIE_BREAK)).orElseThrow();
    }

    /** 0 for Draft and unknown statuses, otherwise the 1-based position in {@code statuses}. */
    public static int statusRank(String status, List<String> statuses) {
        if (status == null || TaskCodec.DRAFT_STATUS.equalsIgnoreCase(status)) {
            return 0;
        }
        for (int i = 0; i < statuses.size(); i++) {
            if (statuses.get(i).equalsIgnoreCase(status)) {
                return i + 1;
            }
        }
        return 0;
    }

    private static Instant modified(Task task) {
        return task.lastModified() == null ? Instant.EPOCH : task.lastModified();
    }
}
