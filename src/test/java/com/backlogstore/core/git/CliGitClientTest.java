package com.backlogstore.core.git;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ForkJoinPool;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link CliGitClient}.
 *
 * <p>Uses a test subclass to intercept git commands, so output parsing and
 * command construction are checked without a real repository.
 */
class CliGitClientTest {

    private TestableCliGitClient git;

    @BeforeEach
    void setUp() {
        git = new TestableCliGitClient();
    }

    @Test
    void realGitRunsWhileCommonPoolIsBusy(@TempDir Path dir) {
        assumeTrue(gitOnPath(), "git is not installed");
        var client = new CliGitClient(dir, "git", Duration.ofSeconds(5), 2);
        var release = new CountDownLatch(1);
        for (int i = 0; i < ForkJoinPool.getCommonPoolParallelism(); i++) {
            CompletableFuture.runAsync(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        try {
            CliGitClient.GitResult result = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> client.run("--version"));
            assertEquals(0, result.exitCode());
            assertTrue(result.stdout().startsWith("git version"));
        } finally {
            release.countDown();
            client.shutdown();
        }
    }

    private static boolean gitOnPath() {
        try {
            return new ProcessBuilder("git", "--version").start().waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // --- branches ---

    @Test
    void currentBranchIsTrimmed() {
        git.respond("rev-parse --abbrev-ref HEAD", 0, "feature/login\n");

        assertEquals("feature/login", git.currentBranch());
    }

    @Test
    void currentBranchFailsOnNonZeroExit() {
        git.respond("rev-parse --abbrev-ref HEAD", 128, "");

        assertThrows(GitCommandException.class, () -> git.currentBranch());
    }

    @Test
    void listLocalBranchesParsesRefsAndCommitTimes() {
        git.respond("for-each-ref", 0, "main 1700000000\nfeature/x 1700000100\n\nbroken-line\n");

        List<BranchInfo> branches = git.listLocalBranches();

        assertEquals(List.of(
                new BranchInfo("main", Instant.ofEpochSecond(1700000000L), false),
                new BranchInfo("feature/x", Instant.ofEpochSecond(1700000100L), false)), branches);
        assertTrue(git.executedCommands().get(0).endsWith("refs/heads/"));
    }

    @Test
    void listRemoteBranchesSkipsHeadPointers() {
        git.respond("for-each-ref", 0, "origin 1700000000\norigin/HEAD 1700000000\norigin/main 1700000050\n");

        List<BranchInfo> branches = git.listRemoteBranches();

        assertEquals(1, branches.size());
        assertEquals("origin/main", branches.get(0).name());
        assertTrue(branches.get(0).remote());
    }

    @Test
    void isRepositoryIsFalseWhenGitCannotRun() {
        git.failWith(new GitCommandException("Failed to start git"));

        assertFalse(git.isRepository());
    }

    @Test
    void isRepositoryFollowsExitCode() {
        git.respond("rev-parse --git-dir", 0, ".git\n");
        assertTrue(git.isRepository());

        git.respond("rev-parse --git-dir", 128, "");
        assertFalse(git.isRepository());
    }

    // --- files ---

    @Test
    void listFilesReturnsBareNames() {
        git.respond("ls-tree", 0, "backlog/tasks/task-1 - A.md\nbacklog/tasks/task-2 - B.md\n");

        assertEquals(List.of("task-1 - A.md", "task-2 - B.md"), git.listFiles("main", "backlog/tasks"));
        assertEquals("ls-tree --name-only main backlog/tasks/", git.executedCommands().get(0));
    }

    @Test
    void listFilesIsEmptyWhenDirectoryIsMissing() {
        git.respond("ls-tree", 128, "");

        assertTrue(git.listFiles("main", "backlog/tasks").isEmpty());
    }

    @Test
    void readFileUsesRefColonPath() {
        git.respond("show", 0, "---\nid: task-1\n---\n");

        Optional<String> content = git.readFile("feature/x", "backlog\\tasks\\task-1 - A.md");

        assertEquals(Optional.of("---\nid: task-1\n---\n"), content);
        assertEquals("show feature/x:backlog/tasks/task-1 - A.md", git.executedCommands().get(0));
    }

    @Test
    void readFileIsEmptyWhenFileIsAbsentOnRef() {
        git.respond("show", 128, "");

        assertTrue(git.readFile("main", "backlog/tasks/nope.md").isEmpty());
    }

    @Test
    void fileModifiedTimesKeepsNewestCommitPerFile() {
        git.respond("log", 0, "\u00001700000200\n\nbacklog/tasks/task-1 - A.md\n"
                + "\u00001700000100\n\nbacklog/tasks/task-1 - A.md\nbacklog/tasks/task-2 - B.md\n");

        Map<String, Instant> times = git.fileModifiedTimes("main", "backlog/tasks");

        assertEquals(Instant.ofEpochSecond(1700000200L), times.get("task-1 - A.md"));
        assertEquals(Instant.ofEpochSecond(1700000100L), times.get("task-2 - B.md"));
        assertEquals(2, times.size());
    }

    @Test
    void pathExistsFollowsExitCode() {
        git.respond("cat-file", 0, "");
        assertTrue(git.pathExists("main", "backlog"));

        git.respond("cat-file", 128, "");
        assertFalse(git.pathExists("main", "backlog"));
    }

    @Test
    void parseRefsIgnoresLinesWithoutTimestamp() {
        List<BranchInfo> branches = CliGitClient.parseRefs("main notanumber\nmain 12\n", false);

        assertEquals(1, branches.size());
        assertEquals(Instant.ofEpochSecond(12), branches.get(0).lastCommitTime());
    }

    // --- Test helper ---

    static class TestableCliGitClient extends CliGitClient {

        private final Map<String, GitResult> responses = new LinkedHashMap<>();
        private final List<String> executedCommands = new ArrayList<>();
        private GitCommandException failure;

        TestableCliGitClient() {
            super(Path.of("/tmp/repo"), "git", Duration.ofSeconds(5), 2);
        }

        /** Answers every command starting with {@code prefix}. */
        void respond(String prefix, int exitCode, String stdout) {
            responses.put(prefix, new GitResult(exitCode, stdout, exitCode == 0 ? "" : "fatal: simulated"));
        }

        void failWith(GitCommandException failure) {
            this.failure = failure;
        }

        List<String> executedCommands() {
            return executedCommands;
        }

        @Override
        GitResult run(String... args) {
            String command = String.join(" ", args);
            executedCommands.add(command);
            if (failure != null) {
                throw failure;
            }
            for (Map.Entry<String, GitResult> response : responses.entrySet()) {
                if (command.startsWith(response.getKey())) {
                    return response.getValue();
                }
            }
            return new GitResult(1, "", "unexpected command: " + command);
        }
    }
}
