package com.backlogstore.core.reconcile;

import com.backlogstore.core.config.ConfigLoader;
import com.backlogstore.core.config.ResolutionStrategy;
import com.backlogstore.core.git.BranchInfo;
import com.backlogstore.core.git.GitClient;
import com.backlogstore.core.git.GitCommandException;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskSource;
import com.backlogstore.core.store.BacklogPaths;
import com.backlogstore.core.store.RecordCache;
import com.backlogstore.core.store.TaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link BranchReconciler}, against an in-memory git history.
 */
class BranchReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-10-16T12:00:00Z");
    private static final Instant T0 = NOW.minus(Duration.ofDays(2));
    private static final String TASKS = "backlog/tasks";

    @TempDir
    Path workspace;

    private BacklogPaths paths;
    private TaskRepository repository;
    private FakeGitClient git;
    private BranchReconciler reconciler;

    @BeforeEach
    void setUp() throws IOException {
        paths = new BacklogPaths(workspace, "backlog");
        Files.createDirectories(paths.backlogDir().resolve("tasks"));
        repository = new TaskRepository(paths, new ConfigLoader(), new RecordCache());
        git = new FakeGitClient("main");
        git.branch("main", NOW, false);
        reconciler = newReconciler(git);
    }

    @AfterEach
    void tearDown() {
        reconciler.shutdown();
    }

    private BranchReconciler newReconciler(GitClient client) {
        return new BranchReconciler(client, repository, 2, 2, 2, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void config(String yaml) throws IOException {
        Files.writeString(paths.backlogDir().resolve("config.yml"), yaml);
    }

    private void localTask(String fileName, String id, String status) throws IOException {
        Files.writeString(paths.backlogDir().resolve("tasks").resolve(fileName), record(id, status));
        git.file("main", fileName, null, T0);
    }

    private static String record(String id, String status) {
        return "---\nid: " + id + "\ntitle: " + id + "\nstatus: " + status + "\n---\n";
    }

    private static Task byId(List<Task> tasks, String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("most_recent")
    class MostRecent {

        @BeforeEach
        void setUp() throws IOException {
            config("check_active_branches: true\ntask_resolution_strategy: most_recent\n");
        }

        @Test
        @DisplayName("a newer branch copy wins and branch-only tasks are added")
        void newerBranchCopyWins() throws IOException {
            localTask("task-1 - One.md", "task-1", "To Do");
            git.branch("feature/a", NOW.minus(Duration.ofDays(1)), false);
            git.file("feature/a", "task-1 - One.md", record("task-1", "In Progress"), T0.plusSeconds(3600));
            git.file("feature/a", "task-2 - Two.md", record("task-2", "To Do"), T0);
            git.file("feature/a", "README.txt", "not a task", T0);

            CrossBranchView view = reconciler.load();

            assertEquals(List.of("TASK-1", "TASK-2"), view.resolved().stream().map(Task::id).toList());
            Task one = byId(view.resolved(), "TASK-1");
            assertEquals("In Progress", one.status());
            assertEquals(TaskSource.LOCAL_BRANCH, one.source());
            assertEquals("feature/a", one.branch());
            assertFalse(one.isWritable());
            assertEquals(paths.backlogDir().resolve("tasks").resolve("task-1 - One.md"), one.filePath());

            assertEquals(1, view.local().size());
            assertEquals(TaskSource.LOCAL, view.local().get(0).source());
            assertEquals("main", view.local().get(0).branch());
            assertEquals(T0, view.local().get(0).lastModified());
            assertEquals(List.of("feature/a"), view.branches());
        }

        @Test
        @DisplayName("older branch copies are never read")
        void olderCopiesAreNotHydrated() throws IOException {
            localTask("task-1 - One.md", "task-1", "To Do");
            git.branch("feature/a", NOW, false);
            git.file("feature/a", "task-1 - One.md", record("task-1", "Done"), T0.minusSeconds(60));

            CrossBranchView view = reconciler.load();

            assertEquals("To Do", byId(view.resolved(), "TASK-1").status());
            assertEquals(TaskSource.LOCAL, byId(view.resolved(), "TASK-1").source());
            assertTrue(git.reads.isEmpty());
        }

        @Test
        @DisplayName("stale branches and branches without a backlog are skipped")
        void skipsStaleAndEmptyBranches() throws IOException {
            localTask("task-1 - One.md", "task-1", "To Do");
            git.branch("old", NOW.minus(Duration.ofDays(90)), false);
            git.file("old", "task-5 - Old.md", record("task-5", "To Do"), NOW.minus(Duration.ofDays(90)));
            git.branch("docs-only", NOW, false);

            CrossBranchView view = reconciler.load();

            assertEquals(List.of("TASK-1"), view.resolved().stream().map(Task::id).toList());
            assertEquals(List.of("docs-only"), view.branches());
        }

        @Test
        @DisplayName("remote branches are scanned only with remote_operations")
        void remoteBranches() throws IOException {
            git.branch("origin/feature-b", NOW, true);
            git.file("origin/feature-b", "task-3 - Remote.md", record("task-3", "To Do"), T0);

            assertTrue(reconciler.load().resolved().isEmpty());

            config("check_active_branches: true\nremote_operations: true\n");
            Files.setLastModifiedTime(paths.backlogDir().resolve("config.yml"),
                    FileTime.from(NOW));
            Task remote = byId(reconciler.load().resolved(), "TASK-3");
            assertEquals(TaskSource.REMOTE, remote.source());
            assertEquals("origin/feature-b", remote.branch());
        }
    }

    @Nested
    @DisplayName("most_progressed")
    class MostProgressed {

        @Test
        @DisplayName("the local Done copy beats a newer In Progress copy")
        void furthestStatusWins() throws IOException {
            config("check_active_branches: true\ntask_resolution_strategy: most_progressed\n");
            localTask("task-1 - One.md", "task-1", "Done");
            git.branch("feature/a", NOW, false);
            git.file("feature/a", "task-1 - One.md", record("task-1", "In Progress"), NOW);

            CrossBranchView view = reconciler.load();

            Task one = byId(view.resolved(), "TASK-1");
            assertEquals("Done", one.status());
            assertEquals(TaskSource.LOCAL, one.source());
            assertEquals(List.of("feature/a:" + TASKS + "/task-1 - One.md"), git.reads);
        }
    }

    @Nested
    @DisplayName("fallback to local tasks")
    class Fallback {

        @Test
        @DisplayName("git is not consulted when cross-branch loading is off")
        void disabled() throws IOException {
            localTask("task-1 - One.md", "task-1", "To Do");
            GitClient mockGit = mock(GitClient.class);
            BranchReconciler offline = newReconciler(mockGit);
            try {
                CrossBranchView view = offline.load();

                assertEquals(List.of("TASK-1"), view.resolved().stream().map(Task::id).toList());
                assertTrue(view.branches().isEmpty());
                verifyNoInteractions(mockGit);
            } finally {
                offline.shutdown();
            }
        }

        @Test
        @DisplayName("outside a repository only local tasks are shown")
        void notARepository() throws IOException {
            config("check_active_branches: true\n");
            localTask("task-1 - One.md", "task-1", "To Do");
            GitClient mockGit = mock(GitClient.class);
            when(mockGit.isRepository()).thenReturn(false);
            BranchReconciler offline = newReconciler(mockGit);
            try {
                assertEquals(1, offline.load().resolved().size());
                verify(mockGit, never()).listLocalBranches();
            } finally {
                offline.shutdown();
            }
        }

        @Test
        @DisplayName("a git failure falls back to local tasks")
        void gitFailure() throws IOException {
            config("check_active_branches: true\n");
            localTask("task-1 - One.md", "task-1", "To Do");
            GitClient mockGit = mock(GitClient.class);
            when(mockGit.isRepository()).thenReturn(true);
            when(mockGit.currentBranch()).thenThrow(new GitCommandException("git rev-parse timed out"));
            BranchReconciler offline = newReconciler(mockGit);
            try {
                CrossBranchView view = offline.load();

                assertEquals(List.of("TASK-1"), view.resolved().stream().map(Task::id).toList());
                assertEquals(TaskSource.LOCAL, view.resolved().get(0).source());
            } finally {
                offline.shutdown();
            }
        }
    }

    @Test
    @DisplayName("branches are ordered current, main, then most recent first")
    void branchOrder() throws IOException {
        config("check_active_branches: true\n");
        git.branch("feature/old", NOW.minus(Duration.ofDays(5)), false);
        git.branch("feature/new", NOW.minus(Duration.ofHours(1)), false);
        git.branch("topic", NOW.minus(Duration.ofDays(100)), false);
        FakeGitClient onTopic = new FakeGitClient("topic");
        onTopic.branches.addAll(git.branches);

        BranchReconciler reconcilerOnTopic = newReconciler(onTopic);
        try {
            List<String> names = reconcilerOnTopic.selectBranches(repository.config(), "topic").stream()
                    .map(BranchInfo::name).toList();

            assertEquals(List.of("topic", "main", "feature/new", "feature/old"), names);
        } finally {
            reconcilerOnTopic.shutdown();
        }
    }

    @Test
    void shouldHydrate() {
        var entry = new BranchReconciler.IndexEntry("task-1 - One.md", "TASK-1", T0, "a", false);

        assertTrue(BranchReconciler.shouldHydrate(entry, Map.of(), ResolutionStrategy.MOST_RECENT));
    }

    // --- Test helper ---

    /** In-memory branches, files and commit times. */
    static class FakeGitClient implements GitClient {

        private final String current;
        final List<BranchInfo> branches = new ArrayList<>();
        private final Map<String, Map<String, String>> files = new HashMap<>();
        private final Map<String, Map<String, Instant>> times = new HashMap<>();
        final List<String> reads = Collections.synchronizedList(new ArrayList<>());

        FakeGitClient(String current) {
            this.current = current;
        }

        void branch(String name, Instant lastCommit, boolean remote) {
            branches.add(new BranchInfo(name, lastCommit, remote));
        }

        /** A file on a branch; {@code null} content only records the commit time. */
        void file(String branch, String fileName, String content, Instant modified) {
            files.computeIfAbsent(branch, k -> new LinkedHashMap<>()).put(fileName, content);
            times.computeIfAbsent(branch, k -> new HashMap<>()).put(fileName, modified);
        }

        @Override
        public boolean isRepository() {
            return true;
        }

        @Override
        public String currentBranch() {
            return current;
        }

        @Override
        public List<BranchInfo> listLocalBranches() {
            return branches.stream().filter(b -> !b.remote()).toList();
        }

        @Override
        public List<BranchInfo> listRemoteBranches() {
            return branches.stream().filter(BranchInfo::remote).toList();
        }

        @Override
        public List<String> listFiles(String ref, String dir) {
            return new ArrayList<>(files.getOrDefault(ref, Map.of()).keySet());
        }

        @Override
        public Optional<String> readFile(String ref, String path) {
            reads.add(ref + ":" + path);
            String name = path.substring(path.lastIndexOf('/') + 1);
            return Optional.ofNullable(files.getOrDefault(ref, Map.of()).get(name));
        }

        @Override
        public Map<String, Instant> fileModifiedTimes(String ref, String dir) {
            return times.getOrDefault(ref, Map.of());
        }

        @Override
        public boolean pathExists(String ref, String path) {
            return files.containsKey(ref);
        }
    }
}
