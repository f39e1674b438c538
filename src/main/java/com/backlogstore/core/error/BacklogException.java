package com.backlogstore.core.error;

/**
 * Base type for every failure the store reports to its callers.
 * The store never retries; callers decide what to do with each subtype.
 */
public class BacklogException extends RuntimeException {
    public BacklogException(String message) {
        super(message);
    }

    public BacklogException(String message, Throwable cause) {
        super(message, cause);
    }
}
