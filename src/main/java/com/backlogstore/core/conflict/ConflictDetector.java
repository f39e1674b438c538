package com.backlogstore.core.conflict;

import com.backlogstore.core.error.StoreIoException;
import com.backlogstore.core.error.TaskConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.UnaryOperator;

/**
 * Optimistic concurrency gate for every record write.
 *
 * <p>There is no locking. A writer passes the token of the content it read;
 * if the file changed in the meantime the write is refused with a
 * {@link TaskConflictException} carrying what is on disk now. A {@code null}
 * token skips the check.
 */
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    /**
     * Reads {@code path}, verifies {@code expectedToken}, applies {@code mutator}
     * and persists the result.
     *
     * @param mutator receives the current content, or {@code null} when the file does not exist yet
     * @throws TaskConflictException when the token does not match the current content
     * @throws StoreIoException      on any filesystem failure
     */
    public WriteResult checkedWrite(Path path, String expectedToken, UnaryOperator<String> mutator) {
        String current = verify(path, expectedToken);
        return write(path, mutator.apply(current));
    }

    /**
     * Checks that {@code path} still holds the content {@code expectedToken}
     * was computed from.
     *
     * @return the current content, {@code null} when the file does not exist
     * @throws TaskConflictException when the token does not match
     */
    public String verify(Path path, String expectedToken) {
        String current = readIfExists(path);
        if (expectedToken != null) {
            String currentToken = current == null ? null : StateTokens.compute(current);
            if (!expectedToken.equals(currentToken)) {
                log.info("Refusing write to {}: content changed since it was read", path);
                throw new TaskConflictException(path, current, currentToken);
            }
        }
        return current;
    }

    /** Unconditional write, used for new records. */
    public WriteResult write(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, ".backlog-", ".tmp");
            try {
                Files.writeString(temp, content, StandardCharsets.UTF_8);
                try {
                    Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StoreIoException("Failed to write " + path, e);
        }
        return new WriteResult(content, StateTokens.compute(content));
    }

    /** Current content of {@code path}, or {@code null} if there is no such file. */
    public String readIfExists(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new StoreIoException("Failed to read " + path, e);
        }
    }
}
