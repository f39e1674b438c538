package com.backlogstore.core.model;

/**
 * Where a task snapshot was read from. Only {@link #LOCAL} snapshots are writable.
 */
public enum TaskSource {
    LOCAL("local"),
    LOCAL_BRANCH("local-branch"),
    REMOTE("remote"),
    COMPLETED("completed");

    private final String wireValue;

    TaskSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
