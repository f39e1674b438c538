package com.backlogstore.core.model;

import java.nio.file.Path;

/**
 * Result of creating a task or draft.
 *
 * @param id    the assigned id, e.g. {@code TASK-7}
 * @param path  the new record file
 * @param token state token of the written content
 */
public record CreatedTask(String id, Path path, String token) {
}
