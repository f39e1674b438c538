package com.backlogstore.core.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskFilesTest {

    @TempDir
    Path dir;

    @Test
    void sanitizesTitlesForFileNames() {
        assertEquals("Fix-bug-123-urgent", TaskFiles.sanitizeTitle("Fix: bug #123 (urgent!)"));
        assertEquals("a-b", TaskFiles.sanitizeTitle("  a __ - b  "));
        assertEquals("untitled", TaskFiles.sanitizeTitle("?!"));
        assertEquals("Überprüfung", TaskFiles.sanitizeTitle("Überprüfung"));
    }

    @Test
    void fileNameUsesLowerCaseId() {
        assertEquals("task-7 - Fix-login.md", TaskFiles.fileName("TASK-7", "Fix login"));
        assertEquals("task-7.2 - Child.md", TaskFiles.fileName("TASK-7.2", "Child"));
    }

    @Test
    void listsMarkdownFilesByName() throws IOException {
        Files.writeString(dir.resolve("task-2 - B.md"), "");
        Files.writeString(dir.resolve("task-1 - A.md"), "");
        Files.writeString(dir.resolve("notes.txt"), "");
        Files.createDirectory(dir.resolve("sub.md"));

        List<Path> files = TaskFiles.listRecords(dir);

        assertEquals(List.of("task-1 - A.md", "task-2 - B.md"),
                files.stream().map(p -> p.getFileName().toString()).toList());
        assertTrue(TaskFiles.listRecords(dir.resolve("missing")).isEmpty());
    }

    @Test
    void highestNumberIgnoresOtherPrefixesAndSubtasks() {
        List<Path> files = List.of(
                Path.of("task-2 - A.md"),
                Path.of("TASK-10.3 - B.md"),
                Path.of("taskforce-99 - C.md"),
                Path.of("bug-50 - D.md"),
                Path.of("task-99999999999 - Huge.md"));

        assertEquals(10, TaskFiles.highestNumber(files, "task"));
        assertEquals(0, TaskFiles.highestNumber(List.of(), "task"));
    }

    @Test
    void highestSubtaskNumber() {
        List<String> ids = List.of("TASK-1", "TASK-1.1", "task-1.4", "TASK-1.2.7", "TASK-10.9", "TASK-1.x");

        assertEquals(4, TaskFiles.highestSubtaskNumber(ids, "TASK-1"));
        assertEquals(0, TaskFiles.highestSubtaskNumber(ids, "TASK-2"));
    }
}
