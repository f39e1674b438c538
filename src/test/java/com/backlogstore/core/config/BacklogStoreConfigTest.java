package com.backlogstore.core.config;

import com.backlogstore.core.events.TaskEventBus;
import com.backlogstore.core.git.GitClient;
import com.backlogstore.core.reconcile.BranchReconciler;
import com.backlogstore.core.store.BacklogPaths;
import com.backlogstore.core.store.TaskStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BacklogStoreConfigTest {

    @TempDir
    Path workspace;

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BacklogStoreConfig.class));

    @Test
    void wiresStoreFromProperties() {
        runner.withPropertyValues("backlog.root=" + workspace, "backlog.folder=tracker")
                .run(context -> {
                    assertNotNull(context.getBean(TaskStore.class));
                    assertNotNull(context.getBean(BranchReconciler.class));
                    assertNotNull(context.getBean(TaskEventBus.class));
                    assertEquals(workspace.toAbsolutePath().normalize().resolve("tracker"),
                            context.getBean(BacklogPaths.class).backlogDir());
                });
    }

    @Test
    void propertyDefaults() {
        runner.withPropertyValues("backlog.root=" + workspace).run(context -> {
            BacklogStoreProperties properties = context.getBean(BacklogStoreProperties.class);
            assertEquals("backlog", properties.getFolder());
            assertFalse(properties.isStampUpdatedDate());
            assertEquals(30, properties.getStatusCallbackTimeoutSeconds());
            assertEquals("git", properties.getGit().getExecutable());
            assertEquals(10, properties.getGit().getTimeoutSeconds());
            assertEquals(5, properties.getReconcile().getBranchBatchSize());
            assertEquals(8, properties.getReconcile().getHydrateBatchSize());
        });
    }

    @Test
    void nestedPropertiesBind() {
        runner.withPropertyValues("backlog.root=" + workspace, "backlog.stamp-updated-date=true",
                        "backlog.git.executable=/usr/local/bin/git", "backlog.reconcile.threads=2")
                .run(context -> {
                    BacklogStoreProperties properties = context.getBean(BacklogStoreProperties.class);
                    assertTrue(properties.isStampUpdatedDate());
                    assertEquals("/usr/local/bin/git", properties.getGit().getExecutable());
                    assertEquals(2, properties.getReconcile().getThreads());
                });
    }

    @Test
    void userBeansWin() {
        GitClient git = mock(GitClient.class);
        runner.withPropertyValues("backlog.root=" + workspace)
                .withBean(GitClient.class, () -> git)
                .run(context -> assertSame(git, context.getBean(GitClient.class)));
    }
}
