package com.backlogstore.core.model;

import java.util.List;

/**
 * Selection of folders for {@code listTasks}.
 */
public enum TaskScope {
    ACTIVE(List.of(TaskFolder.TASKS)),
    DRAFTS(List.of(TaskFolder.DRAFTS)),
    COMPLETED(List.of(TaskFolder.COMPLETED)),
    ARCHIVED(List.of(TaskFolder.ARCHIVE_TASKS, TaskFolder.ARCHIVE_DRAFTS)),
    ALL(List.of(TaskFolder.TASKS, TaskFolder.DRAFTS, TaskFolder.COMPLETED,
            TaskFolder.ARCHIVE_TASKS, TaskFolder.ARCHIVE_DRAFTS));

    private final List<TaskFolder> folders;

    TaskScope(List<TaskFolder> folders) {
        this.folders = folders;
    }

    public List<TaskFolder> folders() {
        return folders;
    }
}
