package com.backlogstore.core.config;

import com.backlogstore.core.conflict.ConflictDetector;
import com.backlogstore.core.events.TaskEventBus;
import com.backlogstore.core.git.CliGitClient;
import com.backlogstore.core.git.GitClient;
import com.backlogstore.core.reconcile.BranchReconciler;
import com.backlogstore.core.store.BacklogInitializer;
import com.backlogstore.core.store.BacklogPaths;
import com.backlogstore.core.store.RecordCache;
import com.backlogstore.core.store.ReferenceSanitizer;
import com.backlogstore.core.store.StatusChangeHook;
import com.backlogstore.core.store.TaskRepository;
import com.backlogstore.core.store.TaskStore;
import com.backlogstore.core.store.TaskWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the store for one workspace from {@code backlog.*} properties.
 * Any bean can be replaced by declaring one of the same type.
 */
@AutoConfiguration
@EnableConfigurationProperties(BacklogStoreProperties.class)
public class BacklogStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(BacklogStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock backlogClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public BacklogPaths backlogPaths(BacklogStoreProperties properties) {
        var paths = new BacklogPaths(Path.of(properties.getRoot()), properties.getFolder());
        log.info("Backlog store at {}", paths.backlogDir());
        return paths;
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigLoader configLoader() {
        return new ConfigLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConflictDetector conflictDetector() {
        return new ConflictDetector();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskEventBus taskEventBus() {
        return new TaskEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public GitClient gitClient(BacklogPaths paths, BacklogStoreProperties properties) {
        BacklogStoreProperties.Git git = properties.getGit();
        return new CliGitClient(paths.workspaceRoot(), git.getExecutable(),
                Duration.ofSeconds(git.getTimeoutSeconds()), git.getMaxProcesses());
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskRepository taskRepository(BacklogPaths paths, ConfigLoader configLoader) {
        return new TaskRepository(paths, configLoader, new RecordCache());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReferenceSanitizer referenceSanitizer(TaskRepository repository, ConflictDetector conflictDetector,
                                                 TaskEventBus eventBus) {
        return new ReferenceSanitizer(repository, conflictDetector, eventBus);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusChangeHook statusChangeHook(BacklogPaths paths, BacklogStoreProperties properties) {
        return new StatusChangeHook(paths.workspaceRoot(),
                Duration.ofSeconds(properties.getStatusCallbackTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskWriter taskWriter(TaskRepository repository, ConflictDetector conflictDetector, TaskEventBus eventBus,
                                 ReferenceSanitizer sanitizer, StatusChangeHook statusChangeHook,
                                 BacklogStoreProperties properties, Clock backlogClock) {
        return new TaskWriter(repository, conflictDetector, eventBus, sanitizer, statusChangeHook,
                properties.isStampUpdatedDate(), backlogClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BranchReconciler branchReconciler(GitClient gitClient, TaskRepository repository,
                                             BacklogStoreProperties properties, Clock backlogClock) {
        BacklogStoreProperties.Reconcile reconcile = properties.getReconcile();
        return new BranchReconciler(gitClient, repository, reconcile.getBranchBatchSize(),
                reconcile.getHydrateBatchSize(), reconcile.getThreads(), backlogClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BacklogInitializer backlogInitializer() {
        return new BacklogInitializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(TaskRepository repository, TaskWriter writer, BranchReconciler reconciler,
                               ConflictDetector conflictDetector, TaskEventBus eventBus) {
        return new TaskStore(repository, writer, reconciler, conflictDetector, eventBus);
    }
}
