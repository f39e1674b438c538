package com.backlogstore.core.reconcile;

import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.config.ResolutionStrategy;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionPolicyTest {

    private static final List<String> STATUSES = List.of("To Do", "In Progress", "Done");
    private static final Instant T0 = Instant.parse("2026-10-01T10:00:00Z");

    private static Task task(String status, TaskSource source, String branch, Instant modified) {
        String content = "---\nid: task-1\ntitle: One\nstatus: " + status + "\n---\n";
        return TaskCodec.decode(content, Path.of("task-1 - One.md"), TaskFolder.TASKS, STATUSES, null)
                .withProvenance(source, branch, modified);
    }

    @Nested
    @DisplayName("most_recent")
    class MostRecent {

        @Test
        @DisplayName("latest modification wins")
        void latestWins() {
            Task local = task("To Do", TaskSource.LOCAL, "main", T0);
            Task branch = task("In Progress", TaskSource.LOCAL_BRANCH, "feature/a", T0.plusSeconds(60));

            assertSame(branch, ResolutionPolicy.resolve(List.of(local, branch), ResolutionStrategy.MOST_RECENT, STATUSES));
        }

        @Test
        @DisplayName("ties go to the local copy, then to the first branch name")
        void tieBreak() {
            Task remote = task("Done", TaskSource.REMOTE, "origin/zeta", T0);
            Task alpha = task("Done", TaskSource.LOCAL_BRANCH, "alpha", T0);
            Task local = task("To Do", TaskSource.LOCAL, "main", T0);

            assertSame(local, ResolutionPolicy.resolve(List.of(remote, alpha, local),
                    ResolutionStrategy.MOST_RECENT, STATUSES));
            assertSame(alpha, ResolutionPolicy.resolve(List.of(remote, alpha),
                    ResolutionStrategy.MOST_RECENT, STATUSES));
        }

        @Test
        @DisplayName("a missing time counts as oldest")
        void missingTime() {
            Task unknown = task("Done", TaskSource.LOCAL_BRANCH, "a", null);
            Task dated = task("To Do", TaskSource.LOCAL_BRANCH, "b", T0);

            assertSame(dated, ResolutionPolicy.resolve(List.of(unknown, dated), ResolutionStrategy.MOST_RECENT, STATUSES));
        }
    }

    @Nested
    @DisplayName("most_progressed")
    class MostProgressed {

        @Test
        @DisplayName("furthest status wins regardless of time")
        void furthestWins() {
            Task done = task("Done", TaskSource.LOCAL_BRANCH, "old", T0);
            Task newer = task("In Progress", TaskSource.LOCAL, "main", T0.plusSeconds(3600));

            assertSame(done, ResolutionPolicy.resolve(List.of(newer, done), ResolutionStrategy.MOST_PROGRESSED, STATUSES));
        }

        @Test
        @DisplayName("draft and unknown statuses rank below the first status")
        void draftAndUnknownRankLowest() {
            Task draft = task("Draft", TaskSource.LOCAL, "main", T0);
            Task blocked = task("Blocked", TaskSource.LOCAL_BRANCH, "a", T0);
            Task todo = task("To Do", TaskSource.LOCAL_BRANCH, "b", T0);

            assertSame(todo, ResolutionPolicy.resolve(List.of(draft, blocked, todo),
                    ResolutionStrategy.MOST_PROGRESSED, STATUSES));
            assertSame(draft, ResolutionPolicy.resolve(List.of(blocked, draft),
                    ResolutionStrategy.MOST_PROGRESSED, STATUSES));
        }
    }

    @Nested
    @DisplayName("three copies of one task")
    class ThreeCopies {

        private final Task done = task("Done", TaskSource.LOCAL_BRANCH, "release", T0);
        private final Task todo = task("To Do", TaskSource.LOCAL, "main", T0.plusSeconds(7200));
        private final Task inProgress = task("In Progress", TaskSource.REMOTE, "origin/feature", T0.plusSeconds(3600));

        private List<List<Task>> orders() {
            return List.of(
                    List.of(done, todo, inProgress),
                    List.of(done, inProgress, todo),
                    List.of(todo, done, inProgress),
                    List.of(todo, inProgress, done),
                    List.of(inProgress, done, todo),
                    List.of(inProgress, todo, done));
        }

        @Test
        @DisplayName("most_recent picks the newest copy in every input order")
        void mostRecent() {
            for (List<Task> order : orders()) {
                assertSame(todo, ResolutionPolicy.resolve(order, ResolutionStrategy.MOST_RECENT, STATUSES));
            }
        }

        @Test
        @DisplayName("most_progressed picks the Done copy in every input order")
        void mostProgressed() {
            for (List<Task> order : orders()) {
                assertSame(done, ResolutionPolicy.resolve(order, ResolutionStrategy.MOST_PROGRESSED, STATUSES));
            }
        }
    }

    @Test
    void statusRank() {
        assertEquals(0, ResolutionPolicy.statusRank(null, STATUSES));
        assertEquals(0, ResolutionPolicy.statusRank("draft", STATUSES));
        assertEquals(0, ResolutionPolicy.statusRank("Blocked", STATUSES));
        assertEquals(1, ResolutionPolicy.statusRank("to do", STATUSES));
        assertEquals(3, ResolutionPolicy.statusRank("Done", STATUSES));
    }

    @Test
    void rejectsEmptyCandidates() {
        assertThrows(IllegalArgumentException.class,
                () -> ResolutionPolicy.resolve(List.of(), ResolutionStrategy.MOST_RECENT, STATUSES));
    }
}
