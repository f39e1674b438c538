package com.backlogstore.core.store;

import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.config.BacklogConfig;
import com.backlogstore.core.config.ConfigLoader;
import com.backlogstore.core.conflict.StateTokens;
import com.backlogstore.core.error.StoreIoException;
import com.backlogstore.core.error.TaskNotFoundException;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskIds;
import com.backlogstore.core.model.TaskScope;
import com.backlogstore.core.model.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the working tree: lists and finds task records in the backlog
 * folders, parsing each file at most once per modification.
 *
 * <p>Listing never fails because of one bad file: an unreadable record is
 * logged and left out.
 */
public class TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(TaskRepository.class);

    private final BacklogPaths paths;
    private final ConfigLoader configLoader;
    private final RecordCache cache;

    public TaskRepository(BacklogPaths paths, ConfigLoader configLoader, RecordCache cache) {
        this.paths = paths;
        this.configLoader = configLoader;
        this.cache = cache;
    }

    public BacklogPaths paths() {
        return paths;
    }

    public BacklogConfig config() {
        return configLoader.load(paths.backlogDir());
    }

    /** Tasks of the given scope, folder by folder, each folder in file-name order. */
    public List<Task> list(TaskScope scope) {
        Map<String, List<String>> children = childrenByParent();
        var tasks = new ArrayList<Task>();
        for (TaskFolder folder : scope.folders()) {
            for (TaskSnapshot snapshot : listSnapshots(folder)) {
                tasks.add(withSubtasks(snapshot.task(), children));
            }
        }
        return tasks;
    }

    /** Every readable record in one folder, without computed subtasks. */
    public List<TaskSnapshot> listSnapshots(TaskFolder folder) {
        List<String> statuses = config().statuses();
        var snapshots = new ArrayList<TaskSnapshot>();
        for (Path file : TaskFiles.listRecords(paths.folder(folder))) {
            try {
                snapshots.add(read(file, folder, statuses));
            } catch (StoreIoException e) {
                log.warn("Skipping unreadable record {}: {}", file, e.getCause().getMessage());
            } catch (RuntimeException e) {
                log.warn("Skipping record {} that could not be decoded: {}", file, e.toString());
            }
        }
        return snapshots;
    }

    /**
     * Looks a task up by id (case-insensitive) in tasks, drafts, completed and
     * the archive, in that order.
     */
    public Optional<TaskSnapshot> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String wanted = id.trim();
        for (TaskFolder folder : TaskScope.ALL.folders()) {
            for (TaskSnapshot snapshot : listSnapshots(folder)) {
                if (snapshot.task().id().equalsIgnoreCase(wanted)) {
                    Task task = withSubtasks(snapshot.task(), childrenByParent());
                    return Optional.of(new TaskSnapshot(task, snapshot.content(), snapshot.token()));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @throws TaskNotFoundException when no folder holds a record with this id
     */
    public TaskSnapshot get(String id) {
        return find(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    /** Ids of every record in every folder. */
    public List<String> allIds() {
        var ids = new ArrayList<String>();
        for (TaskFolder folder : TaskScope.ALL.folders()) {
            for (TaskSnapshot snapshot : listSnapshots(folder)) {
                ids.add(snapshot.task().id());
            }
        }
        return ids;
    }

    /**
     * Reads and parses one record, reusing the cached parse while the file is
     * unchanged.
     *
     * @throws StoreIoException when the file cannot be read
     */
    public TaskSnapshot read(Path file, TaskFolder folder, List<String> statuses) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            RecordCache.Entry cached = cache.get(file, attributes.lastModifiedTime(), attributes.size(), statuses);
            if (cached != null) {
                return new TaskSnapshot(cached.task(), cached.content(), cached.token());
            }
            String content = Files.readString(file, StandardCharsets.UTF_8);
            Task task = TaskCodec.decode(content, file, folder, statuses, attributes.lastModifiedTime().toInstant());
            String token = StateTokens.compute(content);
            cache.put(file, new RecordCache.Entry(attributes.lastModifiedTime(), attributes.size(),
                    statuses, task, content, token));
            return new TaskSnapshot(task, content, token);
        } catch (NoSuchFileException e) {
            cache.invalidate(file);
            throw new StoreIoException("Record " + file + " disappeared while reading", e);
        } catch (IOException e) {
            throw new StoreIoException("Failed to read " + file, e);
        }
    }

    /** Drops any cached parse of {@code file}; called after every write. */
    public void invalidate(Path file) {
        cache.invalidate(file);
    }

    private Map<String, List<String>> childrenByParent() {
        Map<String, List<String>> children = new HashMap<>();
        for (TaskFolder folder : List.of(TaskFolder.TASKS, TaskFolder.DRAFTS, TaskFolder.COMPLETED)) {
            for (TaskSnapshot snapshot : listSnapshots(folder)) {
                Task task = snapshot.task();
                if (task.parentTaskId() != null) {
                    children.computeIfAbsent(task.parentTaskId().toUpperCase(Locale.ROOT), k -> new ArrayList<>())
                            .add(task.id());
                }
            }
        }
        return children;
    }

    /** Header subtasks plus every task that names this one as its parent, in id order. */
    private static Task withSubtasks(Task task, Map<String, List<String>> children) {
        List<String> linked = children.get(task.id().toUpperCase(Locale.ROOT));
        if (linked == null || linked.isEmpty()) {
            return task;
        }
        var all = new LinkedHashSet<>(task.subtasks());
        all.addAll(linked);
        var sorted = new ArrayList<>(all);
        sorted.sort(TaskIds.NATURAL_ORDER);
        return task.withSubtasks(sorted);
    }
}
