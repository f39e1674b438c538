package com.backlogstore.core.model;

/**
 * Logical folders under the backlog directory that hold task records.
 */
public enum TaskFolder {
    TASKS("tasks"),
    DRAFTS("drafts"),
    COMPLETED("completed"),
    ARCHIVE_TASKS("archive/tasks"),
    ARCHIVE_DRAFTS("archive/drafts");

    private final String relativePath;

    TaskFolder(String relativePath) {
        this.relativePath = relativePath;
    }

    /** Path relative to the backlog root, always with forward slashes. */
    public String relativePath() {
        return relativePath;
    }

    public boolean isArchive() {
        return this == ARCHIVE_TASKS || this == ARCHIVE_DRAFTS;
    }

    public boolean isDraftFamily() {
        return this == DRAFTS || this == ARCHIVE_DRAFTS;
    }

    /** Folders whose records may be edited in place. */
    public boolean isWritable() {
        return this == TASKS || this == DRAFTS;
    }
}
