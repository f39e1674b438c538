package com.backlogstore.core.store;

import com.backlogstore.core.codec.DocumentCodec;
import com.backlogstore.core.config.BacklogConfig;
import com.backlogstore.core.conflict.ConflictDetector;
import com.backlogstore.core.conflict.WriteResult;
import com.backlogstore.core.error.TaskNotFoundException;
import com.backlogstore.core.events.TaskEvent;
import com.backlogstore.core.events.TaskEventBus;
import com.backlogstore.core.model.BacklogProgress;
import com.backlogstore.core.model.ChecklistKind;
import com.backlogstore.core.model.CreatedTask;
import com.backlogstore.core.model.Decision;
import com.backlogstore.core.model.DecisionSection;
import com.backlogstore.core.model.Document;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskScope;
import com.backlogstore.core.model.TaskSnapshot;
import com.backlogstore.core.model.TaskUpdate;
import com.backlogstore.core.reconcile.BranchReconciler;
import com.backlogstore.core.reconcile.CrossBranchView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.BiFunction;

/**
 * Entry point for callers: every read and write the store offers.
 *
 * <p>Reads come from the working tree (or, for {@link #listTasksCrossBranch},
 * from all active branches); writes always target the working tree. Writes
 * that take an {@code expectedToken} refuse to overwrite content that changed
 * since the caller read it.
 */
public class TaskStore {

    private static final Logger log = LoggerFactory.getLogger(TaskStore.class);

    private final TaskRepository repository;
    private final TaskWriter writer;
    private final BranchReconciler reconciler;
    private final ConflictDetector conflictDetector;
    private final TaskEventBus eventBus;

    public TaskStore(TaskRepository repository, TaskWriter writer, BranchReconciler reconciler,
                     ConflictDetector conflictDetector, TaskEventBus eventBus) {
        this.repository = repository;
        this.writer = writer;
        this.reconciler = reconciler;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
    }

    public BacklogConfig config() {
        return repository.config();
    }

    public TaskEventBus events() {
        return eventBus;
    }

    // -- tasks: reads ----------------------------------------------------------------------------

    public List<Task> listTasks(TaskScope scope) {
        return repository.list(scope);
    }

    /** Active tasks merged across branches when cross-branch loading is configured. */
    public CrossBranchView listTasksCrossBranch() {
        return reconciler.load();
    }

    /**
     * @throws TaskNotFoundException when no folder holds the id
     */
    public Task getTask(String id) {
        return repository.get(id).task();
    }

    /** The task, its exact text and that text's state token for a later checked write. */
    public TaskSnapshot readTask(String id) {
        return repository.get(id);
    }

    /** Ids of active tasks that list {@code id} among their dependencies. */
    public List<String> getBlockedBy(String id) {
        var blocked = new ArrayList<String>();
        for (Task task : repository.list(TaskScope.ACTIVE)) {
            if (task.dependencies().contains(id)) {
                blocked.add(task.id());
            }
        }
        return blocked;
    }

    /** Configured labels plus every label used by an active task, sorted. */
    public List<String> uniqueLabels() {
        var labels = new TreeSet<>(repository.config().labels());
        for (Task task : repository.list(TaskScope.ACTIVE)) {
            labels.addAll(task.labels());
        }
        return new ArrayList<>(labels);
    }

    public List<String> uniqueAssignees() {
        var assignees = new TreeSet<String>();
        for (Task task : repository.list(TaskScope.ACTIVE)) {
            assignees.addAll(task.assignee());
        }
        return new ArrayList<>(assignees);
    }

    /** Active tasks per configured status; tasks in the last status count as done. */
    public BacklogProgress progress() {
        BacklogConfig config = repository.config();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (String status : config.statuses()) {
            byStatus.put(status, 0);
        }
        List<Task> tasks = repository.list(TaskScope.ACTIVE);
        for (Task task : tasks) {
            byStatus.merge(task.status(), 1, Integer::sum);
        }
        int done = byStatus.getOrDefault(config.doneStatus(), 0);
        return new BacklogProgress(tasks.size(), done, byStatus);
    }

    // -- tasks: writes ---------------------------------------------------------------------------

    public CreatedTask createTask(TaskUpdate fields) {
        return writer.createTask(fields);
    }

    public CreatedTask createDraft(TaskUpdate fields) {
        return writer.createDraft(fields);
    }

    public String updateTask(String id, TaskUpdate update, String expectedToken) {
        return writer.updateTask(id, update, expectedToken);
    }

    public String toggleChecklistItem(String id, ChecklistKind kind, int itemId, String expectedToken) {
        return writer.toggleChecklistItem(id, kind, itemId, expectedToken);
    }

    public TaskWriter.ArchiveResult archiveTask(String id) {
        return writer.archiveTask(id);
    }

    public Path restoreTask(String id) {
        return writer.restoreTask(id);
    }

    public Path completeTask(String id) {
        return writer.completeTask(id);
    }

    public void deleteTask(String id) {
        writer.deleteTask(id);
    }

    public CreatedTask promoteDraft(String id) {
        return writer.promoteDraft(id);
    }

    public CreatedTask demoteTask(String id) {
        return writer.demoteTask(id);
    }

    public String reorderTask(String id, double ordinal, String expectedToken) {
        return writer.reorderTask(id, ordinal, expectedToken);
    }

    public List<OrdinalCalculator.OrdinalUpdate> moveTask(String id, String status, int dropIndex,
                                                          String expectedToken) {
        return writer.moveTask(id, status, dropIndex, expectedToken);
    }

    // -- documents and decisions -----------------------------------------------------------------

    public List<Document> listDocuments() {
        return readAll(repository.paths().docsDir(), DocumentCodec::decodeDocument);
    }

    public Optional<Document> getDocument(String id) {
        return listDocuments().stream().filter(doc -> doc.id().equalsIgnoreCase(id)).findFirst();
    }

    public List<Decision> listDecisions() {
        return readAll(repository.paths().decisionsDir(), DocumentCodec::decodeDecision);
    }

    public Optional<Decision> getDecision(String id) {
        return listDecisions().stream().filter(decision -> decision.id().equalsIgnoreCase(id)).findFirst();
    }

    /**
     * Replaces one section of a decision record, leaving the other sections
     * and the header as they are.
     *
     * @return the token of the new content
     */
    public String updateDecisionSection(String id, DecisionSection section, String text, String expectedToken) {
        Decision decision = getDecision(id).orElseThrow(() -> new TaskNotFoundException(id, "Decision " + id + " not found"));
        Path file = decision.filePath();
        WriteResult result = conflictDetector.checkedWrite(file, expectedToken, current -> {
            if (current == null) {
                throw new TaskNotFoundException(id, "Decision " + id + " not found");
            }
            return DocumentCodec.replaceDecisionSection(current, file, section, text);
        });
        log.info("Updated {} of decision {}", section, decision.id());
        eventBus.publish(TaskEvent.of(TaskEvent.Type.UPDATED, decision.id(), file));
        return result.token();
    }

    private static <T> List<T> readAll(Path dir, BiFunction<String, Path, T> decoder) {
        var records = new ArrayList<T>();
        for (Path file : TaskFiles.listRecords(dir)) {
            try {
                records.add(decoder.apply(Files.readString(file, StandardCharsets.UTF_8), file));
            } catch (IOException e) {
                log.warn("Skipping unreadable record {}: {}", file, e.getMessage());
            }
        }
        return records;
    }
}
