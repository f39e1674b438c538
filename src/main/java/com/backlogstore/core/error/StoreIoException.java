package com.backlogstore.core.error;

import java.io.IOException;

/**
 * Wraps an {@link IOException} from the filesystem (permissions, disk, missing directory).
 */
public class StoreIoException extends BacklogException {
    public StoreIoException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
