package com.backlogstore.core.error;

/**
 * Thrown when a mutation targets a record that is not a writable working-tree task,
 * e.g. a completed or archived record.
 */
public class ReadOnlyTaskException extends BacklogException {
    public ReadOnlyTaskException(String taskId, String reason) {
        super("Task " + taskId + " is read-only: " + reason);
    }
}
