package com.backlogstore.core.error;

import java.nio.file.Path;

/**
 * Thrown by a checked write when the file no longer matches the state token
 * the caller read. Carries the competing content so the caller can reload,
 * overwrite, or show a diff.
 */
public class TaskConflictException extends BacklogException {

    private final Path path;
    private final String currentContent;
    private final String currentToken;

    public TaskConflictException(Path path, String currentContent, String currentToken) {
        super("Record " + path + " was modified since it was read");
        this.path = path;
        this.currentContent = currentContent;
        this.currentToken = currentToken;
    }

    public Path getPath() {
        return path;
    }

    public String getCurrentContent() {
        return currentContent;
    }

    public String getCurrentToken() {
        return currentToken;
    }
}
