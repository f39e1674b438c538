package com.backlogstore.core.git;

import com.backlogstore.core.error.BacklogException;

/**
 * A git invocation that could not be started, timed out, or exited non-zero
 * where a result was required.
 */
public class GitCommandException extends BacklogException {
    public GitCommandException(String message) {
        super(message);
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
