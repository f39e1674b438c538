package com.backlogstore.core.conflict;

import com.backlogstore.core.error.TaskConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConflictDetector} and {@link StateTokens}.
 */
class ConflictDetectorTest {

    @TempDir
    Path dir;

    private ConflictDetector detector;
    private Path file;

    @BeforeEach
    void setUp() {
        detector = new ConflictDetector();
        file = dir.resolve("tasks").resolve("task-1 - One.md");
    }

    @Nested
    @DisplayName("StateTokens")
    class Tokens {

        @Test
        @DisplayName("is the hex SHA-256 of the UTF-8 bytes")
        void sha256() {
            assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                    StateTokens.compute("abc"));
        }

        @Test
        @DisplayName("differs for line endings and trailing blank lines")
        void sensitiveToLayout() {
            String lf = StateTokens.compute("a\nb\n");
            assertNotEquals(lf, StateTokens.compute("a\r\nb\r\n"));
            assertNotEquals(lf, StateTokens.compute("a\nb\n\n"));
            assertEquals(lf, StateTokens.compute("a\nb\n"));
        }
    }

    @Nested
    @DisplayName("checkedWrite")
    class CheckedWrite {

        @Test
        @DisplayName("creates a missing file when no token is given")
        void createsFile() throws IOException {
            WriteResult result = detector.checkedWrite(file, null, current -> {
                assertNull(current);
                return "hello\n";
            });

            assertEquals("hello\n", Files.readString(file));
            assertEquals(StateTokens.compute("hello\n"), result.token());
            assertEquals("hello\n", result.content());
        }

        @Test
        @DisplayName("writes when the token matches the content on disk")
        void matchingToken() throws IOException {
            detector.write(file, "v1\n");

            WriteResult result = detector.checkedWrite(file, StateTokens.compute("v1\n"), current -> current + "v2\n");

            assertEquals("v1\nv2\n", Files.readString(file));
            assertEquals(StateTokens.compute("v1\nv2\n"), result.token());
        }

        @Test
        @DisplayName("refuses a stale token and reports what is on disk")
        void staleToken() throws IOException {
            String staleToken = StateTokens.compute("v1\n");
            detector.write(file, "changed elsewhere\n");

            TaskConflictException e = assertThrows(TaskConflictException.class,
                    () -> detector.checkedWrite(file, staleToken, current -> "mine\n"));

            assertEquals("changed elsewhere\n", e.getCurrentContent());
            assertEquals(StateTokens.compute("changed elsewhere\n"), e.getCurrentToken());
            assertEquals(file, e.getPath());
            assertEquals("changed elsewhere\n", Files.readString(file));
        }

        @Test
        @DisplayName("a token for a file that is gone is a conflict")
        void tokenForMissingFile() {
            TaskConflictException e = assertThrows(TaskConflictException.class,
                    () -> detector.checkedWrite(file, StateTokens.compute("v1\n"), current -> "x"));

            assertNull(e.getCurrentContent());
            assertNull(e.getCurrentToken());
            assertFalse(Files.exists(file));
        }

        @Test
        @DisplayName("the mutator is not called on conflict")
        void mutatorNotCalled() {
            detector.write(file, "v2\n");
            boolean[] called = {false};

            assertThrows(TaskConflictException.class, () -> detector.checkedWrite(file, "not-a-token", current -> {
                called[0] = true;
                return current;
            }));
            assertFalse(called[0]);
        }
    }

    @Nested
    @DisplayName("write")
    class Write {

        @Test
        @DisplayName("leaves no temporary files behind")
        void noTempFiles() throws IOException {
            detector.write(file, "one\n");
            detector.write(file, "two\n");

            try (Stream<Path> files = Files.list(file.getParent())) {
                assertEquals(1, files.count());
            }
            assertEquals("two\n", detector.readIfExists(file));
        }

        @Test
        @DisplayName("readIfExists returns null for a missing file")
        void readMissing() {
            assertNull(detector.readIfExists(dir.resolve("nope.md")));
        }
    }
}
