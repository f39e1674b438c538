package com.backlogstore.core.reconcile;

import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.config.BacklogConfig;
import com.backlogstore.core.config.ResolutionStrategy;
import com.backlogstore.core.git.BranchInfo;
import com.backlogstore.core.git.GitClient;
import com.backlogstore.core.git.GitCommandException;
import com.backlogstore.core.logging.MdcContext;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskIds;
import com.backlogstore.core.model.TaskScope;
import com.backlogstore.core.model.TaskSource;
import com.backlogstore.core.store.BacklogPaths;
import com.backlogstore.core.store.TaskRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a single view of the task list across the branches of the
 * repository.
 *
 * <p>Works in four phases: the working tree is read as usual; every other
 * active branch is indexed from git metadata alone (file names and last
 * commit times); only index entries that could win resolution are read in
 * full; finally all copies of each id are resolved by {@link ResolutionPolicy}.
 * Branch work runs in bounded batches on a small fixed pool.
 *
 * <p>Git trouble never breaks the task list: any git failure falls back to
 * the working-tree tasks with a warning.
 */
public class BranchReconciler {

    private static final Logger log = LoggerFactory.getLogger(BranchReconciler.class);

    private static final Pattern FILE_ID = Pattern.compile("^([a-zA-Z]+-\\d+(?:\\.\\d+)*)");

    private final GitClient git;
    private final TaskRepository repository;
    private final int branchBatchSize;
    private final int hydrateBatchSize;
    private final Clock clock;
    private final ExecutorService executor;

    public BranchReconciler(GitClient git, TaskRepository repository,
                            int branchBatchSize, int hydrateBatchSize, int threads, Clock clock) {
        this.git = git;
        this.repository = repository;
        this.branchBatchSize = Math.max(1, branchBatchSize);
        this.hydrateBatchSize = Math.max(1, hydrateBatchSize);
        this.clock = clock;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "branch-reconciler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** One entry of a branch index: enough to decide whether the file is worth reading. */
    record IndexEntry(String fileName, String taskId, Instant lastModified, String branch, boolean remote) {
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Branch reconciler pool stopped");
    }

    /**
     * Loads active tasks across branches when {@code check_active_branches} is
     * on, otherwise just the working tree.
     */
    public CrossBranchView load() {
        BacklogConfig config = repository.config();
        List<Task> local = repository.list(TaskScope.ACTIVE);
        if (!config.checkActiveBranches()) {
            return CrossBranchView.localOnly(local);
        }
        MdcContext.setOperation("reconcile", null);
        try {
            if (!git.isRepository()) {
                log.warn("{} is not a git repository, showing local tasks only",
                        repository.paths().workspaceRoot());
                return CrossBranchView.localOnly(local);
            }
            return reconcile(config, local);
        } catch (GitCommandException e) {
            log.warn("Cross-branch loading failed, showing local tasks only: {}", e.getMessage());
            return CrossBranchView.localOnly(local);
        } finally {
            MdcContext.clear();
        }
    }

    private CrossBranchView reconcile(BacklogConfig config, List<Task> localTasks) {
        BacklogPaths paths = repository.paths();
        String tasksPath = paths.repositoryPath(TaskFolder.TASKS);
        String currentBranch = git.currentBranch();

        Map<String, Instant> localTimes = git.fileModifiedTimes(currentBranch, tasksPath);
        var local = new ArrayList<Task>();
        var localById = new LinkedHashMap<String, Task>();
        for (Task task : localTasks) {
            Instant committed = localTimes.get(task.filePath().getFileName().toString());
            Task withTime = task.withProvenance(TaskSource.LOCAL, currentBranch,
                    committed != null ? committed : task.lastModified());
            local.add(withTime);
            localById.put(withTime.id(), withTime);
        }

        List<BranchInfo> others = selectBranches(config, currentBranch).stream()
                .filter(branch -> !branch.name().equals(currentBranch))
                .toList();
        if (others.isEmpty()) {
            return new CrossBranchView(local, local, List.of());
        }

        List<IndexEntry> index = inBatches(others, branchBatchSize,
                branch -> indexBranch(branch, paths.repositoryBacklogPath(), tasksPath));
        ResolutionStrategy strategy = config.taskResolutionStrategy();
        List<IndexEntry> toHydrate = index.stream()
                .filter(entry -> shouldHydrate(entry, localById, strategy))
                .toList();
        log.info("Indexed {} task files on {} branch(es), reading {}", index.size(), others.size(), toHydrate.size());

        List<String> statuses = config.statuses();
        List<Task> hydrated = inBatches(toHydrate, hydrateBatchSize,
                entry -> hydrate(entry, paths, tasksPath, statuses).stream().toList());

        Map<String, List<Task>> groups = new LinkedHashMap<>();
        for (Task task : local) {
            groups.computeIfAbsent(task.id(), k -> new ArrayList<>()).add(task);
        }
        for (Task task : hydrated) {
            groups.computeIfAbsent(task.id(), k -> new ArrayList<>()).add(task);
        }
        var resolved = new ArrayList<Task>();
        for (List<Task> group : groups.values()) {
            resolved.add(group.size() == 1 ? group.get(0) : ResolutionPolicy.resolve(group, strategy, statuses));
        }
        resolved.sort(Comparator.comparing(Task::id, TaskIds.NATURAL_ORDER));

        return new CrossBranchView(resolved, local, others.stream().map(BranchInfo::name).toList());
    }

    /**
     * Branches committed to within {@code active_branch_days}, plus the current
     * branch whatever its age. Ordered current first, then main or master,
     * then most recent first.
     */
    List<BranchInfo> selectBranches(BacklogConfig config, String currentBranch) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(config.activeBranchDays()));
        List<BranchInfo> locals = git.listLocalBranches();

        var selected = new ArrayList<BranchInfo>();
        for (BranchInfo branch : locals) {
            if (branch.name().equals(currentBranch) || !branch.lastCommitTime().isBefore(cutoff)) {
                selected.add(branch);
            }
        }
        if (config.remoteOperations()) {
            for (BranchInfo branch : git.listRemoteBranches()) {
                if (!branch.lastCommitTime().isBefore(cutoff)) {
                    selected.add(branch);
                }
            }
        }

        String main = mainBranch(locals);
        selected.sort(Comparator
                .comparing((BranchInfo b) -> b.name().equals(currentBranch) ? 0 : b.name().equals(main) ? 1 : 2)
                .thenComparing(BranchInfo::lastCommitTime, Comparator.reverseOrder())
                .thenComparing(BranchInfo::name));
        return selected;
    }

    private static String mainBranch(List<BranchInfo> branches) {
        for (String candidate : List.of("main", "master")) {
            for (BranchInfo branch : branches) {
                if (branch.name().equals(candidate)) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /** Task files of one branch, from git metadata only. */
    private List<IndexEntry> indexBranch(BranchInfo branch, String backlogPath, String tasksPath) {
        MdcContext.setBranch(branch.name());
        try {
            if (!git.pathExists(branch.name(), backlogPath)) {
                log.debug("No {} on {}", backlogPath, branch.name());
                return List.of();
            }
            Map<String, Instant> times = git.fileModifiedTimes(branch.name(), tasksPath);
            var entries = new ArrayList<IndexEntry>();
            for (String fileName : git.listFiles(branch.name(), tasksPath)) {
                if (!fileName.endsWith(".md")) {
                    continue;
                }
                Matcher m = FILE_ID.matcher(fileName);
                if (!m.find()) {
                    continue;
                }
                entries.add(new IndexEntry(fileName, m.group(1).toUpperCase(Locale.ROOT),
                        times.getOrDefault(fileName, Instant.EPOCH), branch.name(), branch.remote()));
            }
            return entries;
        } finally {
            MdcContext.clearBranch();
        }
    }

    /**
     * Whether an index entry can change the outcome. Ids missing locally and
     * everything under {@code most_progressed} need the content; under
     * {@code most_recent} only copies newer than the local one do.
     */
    static boolean shouldHydrate(IndexEntry entry, Map<String, Task> localById, ResolutionStrategy strategy) {
        Task localTask = localById.get(entry.taskId());
        if (localTask == null || strategy == ResolutionStrategy.MOST_PROGRESSED) {
            return true;
        }
        Instant localTime = localTask.lastModified() == null ? Instant.EPOCH : localTask.lastModified();
        return entry.lastModified().isAfter(localTime);
    }

    private Optional<Task> hydrate(IndexEntry entry, BacklogPaths paths, String tasksPath, List<String> statuses) {
        String repositoryPath = tasksPath + "/" + entry.fileName();
        try {
            Optional<String> content = git.readFile(entry.branch(), repositoryPath);
            if (content.isEmpty()) {
                return Optional.empty();
            }
            Path localPath = paths.folder(TaskFolder.TASKS).resolve(entry.fileName());
            Task task = TaskCodec.decode(content.get(), localPath, TaskFolder.TASKS, statuses, entry.lastModified());
            return Optional.of(task.withProvenance(entry.remote() ? TaskSource.REMOTE : TaskSource.LOCAL_BRANCH,
                    entry.branch(), entry.lastModified()));
        } catch (GitCommandException e) {
            log.warn("Could not read {} on {}: {}", entry.fileName(), entry.branch(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Skipping {} on {}, it could not be decoded: {}", entry.fileName(), entry.branch(), e.toString());
            return Optional.empty();
        }
    }

    /** Runs {@code work} over {@code items} in batches, keeping input order in the result. */
    private <T, R> List<R> inBatches(List<T> items, int batchSize, Function<T, List<R>> work) {
        var results = new ArrayList<R>();
        for (int i = 0; i < items.size(); i += batchSize) {
            List<CompletableFuture<List<R>>> futures = items.subList(i, Math.min(i + batchSize, items.size()))
                    .stream()
                    .map(item -> CompletableFuture.supplyAsync(() -> work.apply(item), executor))
                    .toList();
            for (CompletableFuture<List<R>> future : futures) {
                try {
                    results.addAll(future.join());
                } catch (CompletionException e) {
                    if (e.getCause() instanceof GitCommandException gitFailure) {
                        throw gitFailure;
                    }
                    throw e;
                }
            }
        }
        return results;
    }
}
