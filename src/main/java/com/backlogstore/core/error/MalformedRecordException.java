package com.backlogstore.core.error;

import java.nio.file.Path;

/**
 * Thrown on a write path when a record has a header block that does not parse.
 * Read paths degrade instead of throwing this.
 */
public class MalformedRecordException extends BacklogException {

    private final Path path;

    public MalformedRecordException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
