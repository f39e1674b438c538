package com.backlogstore.core.error;

/**
 * Thrown when an id (or a checklist item inside a record) has no backing file or line.
 */
public class TaskNotFoundException extends BacklogException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        this(taskId, "Task " + taskId + " not found");
    }

    public TaskNotFoundException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
