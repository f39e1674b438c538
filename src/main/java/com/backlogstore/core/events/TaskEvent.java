package com.backlogstore.core.events;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Emitted after a store mutation so views can refresh.
 *
 * @param type      what happened
 * @param taskId    the record this event relates to
 * @param path      record file after the change ({@code null} after a delete)
 * @param timestamp when the mutation finished
 */
public record TaskEvent(
    Type type,
    String taskId,
    Path path,
    Instant timestamp
) {

    public enum Type {
        CREATED,
        UPDATED,
        ARCHIVED,
        RESTORED,
        COMPLETED,
        DELETED,
        PROMOTED,
        DEMOTED,
        SANITIZED
    }

    public static TaskEvent of(Type type, String taskId, Path path) {
        return new TaskEvent(type, taskId, path, Instant.now());
    }
}
