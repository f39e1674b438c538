package com.backlogstore.core.store;

import com.backlogstore.core.codec.DateValues;
import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.config.BacklogConfig;
import com.backlogstore.core.conflict.ConflictDetector;
import com.backlogstore.core.conflict.WriteResult;
import com.backlogstore.core.error.ReadOnlyTaskException;
import com.backlogstore.core.error.StoreIoException;
import com.backlogstore.core.error.TaskNotFoundException;
import com.backlogstore.core.events.TaskEvent;
import com.backlogstore.core.events.TaskEventBus;
import com.backlogstore.core.logging.MdcContext;
import com.backlogstore.core.model.ChecklistKind;
import com.backlogstore.core.model.CreatedTask;
import com.backlogstore.core.model.HeaderField;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskScope;
import com.backlogstore.core.model.TaskSnapshot;
import com.backlogstore.core.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Every mutation of the working tree: create, update, checklist toggle,
 * folder moves (archive, restore, complete, promote, demote) and delete.
 *
 * <p>Edits go through {@link ConflictDetector#checkedWrite} so a stale token
 * is refused instead of overwriting someone else's change. Folder moves act on
 * whole files and keep their bytes except where the move itself changes the
 * id or status.
 */
public class TaskWriter {

    private static final Logger log = LoggerFactory.getLogger(TaskWriter.class);

    static final String DRAFT_PREFIX = "draft";

    private final TaskRepository repository;
    private final ConflictDetector conflictDetector;
    private final TaskEventBus eventBus;
    private final ReferenceSanitizer sanitizer;
    private final StatusChangeHook statusHook;
    private final boolean stampUpdatedDate;
    private final Clock clock;

    public TaskWriter(TaskRepository repository, ConflictDetector conflictDetector, TaskEventBus eventBus,
                      ReferenceSanitizer sanitizer, StatusChangeHook statusHook,
                      boolean stampUpdatedDate, Clock clock) {
        this.repository = repository;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
        this.sanitizer = sanitizer;
        this.statusHook = statusHook;
        this.stampUpdatedDate = stampUpdatedDate;
        this.clock = clock;
    }

    /** Result of archiving: where the record went and what the sanitizer did. */
    public record ArchiveResult(String taskId, Path path, SanitizeResult sanitized) {
    }

    // -- create ----------------------------------------------------------------------------------

    /**
     * Creates a task in {@code tasks/}. With a parent id the new task is
     * numbered {@code PARENT.k}.
     *
     * @throws IllegalArgumentException when no title is given
     */
    public CreatedTask createTask(TaskUpdate fields) {
        String title = requireTitle(fields);
        BacklogConfig config = repository.config();
        BacklogPaths paths = repository.paths();

        String id;
        TaskUpdate effective = fields;
        String parent = fields.string(HeaderField.PARENT_TASK_ID);
        if (parent != null && !parent.isBlank()) {
            String parentId = repository.get(parent).task().id();
            id = parentId + "." + (TaskFiles.highestSubtaskNumber(repository.allIds(), parentId) + 1);
            effective = fields.with(HeaderField.PARENT_TASK_ID, parentId);
        } else {
            List<Path> existing = TaskFiles.listAll(List.of(paths.folder(TaskFolder.TASKS),
                    paths.folder(TaskFolder.COMPLETED), paths.folder(TaskFolder.ARCHIVE_TASKS)));
            id = config.idPrefix() + "-" + (TaskFiles.highestNumber(existing, config.taskPrefix()) + 1);
        }

        String status = fields.string(HeaderField.STATUS) != null
                ? TaskCodec.normalizeStatus(fields.string(HeaderField.STATUS), config.statuses())
                : config.initialStatus();
        Path file = paths.folder(TaskFolder.TASKS).resolve(TaskFiles.fileName(id, title));
        return create(id, status, file, effective, TaskEvent.Type.CREATED);
    }

    /**
     * Creates a draft in {@code drafts/}, numbered {@code DRAFT-n}.
     *
     * @throws IllegalArgumentException when no title is given
     */
    public CreatedTask createDraft(TaskUpdate fields) {
        String title = requireTitle(fields);
        String id = nextDraftId();
        Path file = repository.paths().folder(TaskFolder.DRAFTS).resolve(TaskFiles.fileName(id, title));
        return create(id, TaskCodec.DRAFT_STATUS, file, fields.without(HeaderField.STATUS), TaskEvent.Type.CREATED);
    }

    private CreatedTask create(String id, String status, Path file, TaskUpdate fields, TaskEvent.Type eventType) {
        MdcContext.setOperation("create", id);
        try {
            BacklogConfig config = repository.config();
            String created = DateValues.format(LocalDateTime.now(clock), config.datesWithTime());
            String content = TaskCodec.encodeNew(id, status, created, fields.without(HeaderField.ID));
            WriteResult result = conflictDetector.checkedWrite(file, null, current -> {
                if (current != null) {
                    throw new StoreIoException("Refusing to overwrite existing record " + file,
                            new FileAlreadyExistsException(file.toString()));
                }
                return content;
            });
            repository.invalidate(file);
            log.info("Created {} at {}", id, file.getFileName());
            eventBus.publish(TaskEvent.of(eventType, id, file));
            return new CreatedTask(id, file, result.token());
        } finally {
            MdcContext.clear();
        }
    }

    // -- edit ------------------------------------------------------------------------------------

    /**
     * Applies a partial update.
     *
     * @param expectedToken token of the content the caller read, or {@code null} to skip the check
     * @return the token of the new content
     */
    public String updateTask(String taskId, TaskUpdate update, String expectedToken) {
        MdcContext.setOperation("update", taskId);
        try {
            TaskSnapshot snapshot = repository.get(taskId);
            Task task = requireWritable(snapshot.task());
            BacklogConfig config = repository.config();

            TaskUpdate effective = update;
            String newStatus = null;
            if (update.sets(HeaderField.STATUS) && update.string(HeaderField.STATUS) != null) {
                newStatus = task.folder().isDraftFamily()
                        ? update.string(HeaderField.STATUS)
                        : TaskCodec.normalizeStatus(update.string(HeaderField.STATUS), config.statuses());
                effective = effective.with(HeaderField.STATUS, newStatus);
            }
            if (stampUpdatedDate && !update.sets(HeaderField.UPDATED_DATE) && !update.isEmpty()) {
                effective = effective.with(HeaderField.UPDATED_DATE,
                        DateValues.format(LocalDateTime.now(clock), config.datesWithTime()));
            }

            TaskUpdate changes = effective;
            Path file = task.filePath();
            WriteResult result = conflictDetector.checkedWrite(file, expectedToken, current -> {
                if (current == null) {
                    throw new TaskNotFoundException(task.id());
                }
                return TaskCodec.applyUpdate(current, file, task.id(), changes);
            });
            repository.invalidate(file);
            log.info("Updated {} ({})", task.id(), update);
            eventBus.publish(TaskEvent.of(TaskEvent.Type.UPDATED, task.id(), file));

            if (newStatus != null && !newStatus.equals(task.status())) {
                String title = update.string(HeaderField.TITLE) != null ? update.string(HeaderField.TITLE) : task.title();
                String taskCommand = update.sets(HeaderField.ON_STATUS_CHANGE)
                        ? update.string(HeaderField.ON_STATUS_CHANGE)
                        : task.onStatusChange();
                statusHook.run(taskCommand, config.onStatusChange(), task.id(), task.status(), newStatus, title);
            }
            return result.token();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Flips one checklist item. Every line carrying the item id in that list
     * is flipped.
     *
     * @return the token of the new content
     * @throws TaskNotFoundException when the task or the item does not exist
     */
    public String toggleChecklistItem(String taskId, ChecklistKind kind, int itemId, String expectedToken) {
        MdcContext.setOperation("toggle", taskId);
        try {
            Task task = requireWritable(repository.get(taskId).task());
            Path file = task.filePath();
            WriteResult result = conflictDetector.checkedWrite(file, expectedToken, current -> {
                if (current == null) {
                    throw new TaskNotFoundException(task.id());
                }
                return TaskCodec.toggleChecklist(current, file, task.id(), kind, itemId);
            });
            repository.invalidate(file);
            log.debug("Toggled {} #{} of {}", kind, itemId, task.id());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.UPDATED, task.id(), file));
            return result.token();
        } finally {
            MdcContext.clear();
        }
    }

    public String reorderTask(String taskId, double ordinal, String expectedToken) {
        return updateTask(taskId, TaskUpdate.builder().ordinal(ordinal).build(), expectedToken);
    }

    /**
     * Moves a task into {@code status} at position {@code dropIndex} of that
     * status column, writing the ordinals {@link OrdinalCalculator} assigns.
     *
     * @return the ordinal updates that were written
     */
    public List<OrdinalCalculator.OrdinalUpdate> moveTask(String taskId, String status, int dropIndex,
                                                          String expectedToken) {
        Task moving = requireWritable(repository.get(taskId).task());
        String target = TaskCodec.normalizeStatus(status, repository.config().statuses());

        var column = new ArrayList<OrdinalCalculator.Card>();
        for (Task task : repository.list(TaskScope.ACTIVE)) {
            if (task.status().equals(target)) {
                column.add(new OrdinalCalculator.Card(task.id(), task.ordinal()));
            }
        }
        column.sort(OrdinalCalculator.BY_ORDINAL);

        List<OrdinalCalculator.OrdinalUpdate> updates = OrdinalCalculator.calculateForDrop(
                column, new OrdinalCalculator.Card(moving.id(), moving.ordinal()), dropIndex);
        for (OrdinalCalculator.OrdinalUpdate update : updates) {
            if (update.taskId().equals(moving.id())) {
                updateTask(moving.id(), TaskUpdate.builder().status(target).ordinal(update.ordinal()).build(),
                        expectedToken);
            } else {
                updateTask(update.taskId(), TaskUpdate.builder().ordinal(update.ordinal()).build(), null);
            }
        }
        return updates;
    }

    // -- folder moves ----------------------------------------------------------------------------

    /**
     * Moves a task to {@code archive/tasks} (a draft to {@code archive/drafts})
     * and then removes its id from other tasks' dependencies and references.
     */
    public ArchiveResult archiveTask(String taskId) {
        MdcContext.setOperation("archive", taskId);
        try {
            Task task = requireWritable(repository.get(taskId).task());
            TaskFolder target = task.folder() == TaskFolder.DRAFTS ? TaskFolder.ARCHIVE_DRAFTS : TaskFolder.ARCHIVE_TASKS;
            Path moved = move(task, target);
            log.info("Archived {} to {}", task.id(), target.relativePath());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.ARCHIVED, task.id(), moved));
            SanitizeResult sanitized = sanitizer.sanitize(task.id());
            return new ArchiveResult(task.id(), moved, sanitized);
        } finally {
            MdcContext.clear();
        }
    }

    /** Moves an archived or completed record back to {@code tasks/} (drafts back to {@code drafts/}). */
    public Path restoreTask(String taskId) {
        MdcContext.setOperation("restore", taskId);
        try {
            Task task = repository.get(taskId).task();
            TaskFolder target = switch (task.folder()) {
                case ARCHIVE_TASKS, COMPLETED -> TaskFolder.TASKS;
                case ARCHIVE_DRAFTS -> TaskFolder.DRAFTS;
                default -> throw new IllegalStateException(
                        task.id() + " is not archived or completed, it is in " + task.folder().relativePath());
            };
            Path moved = move(task, target);
            log.info("Restored {} to {}", task.id(), target.relativePath());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.RESTORED, task.id(), moved));
            return moved;
        } finally {
            MdcContext.clear();
        }
    }

    /** Moves a task from {@code tasks/} to {@code completed/}. */
    public Path completeTask(String taskId) {
        MdcContext.setOperation("complete", taskId);
        try {
            Task task = requireWritable(repository.get(taskId).task());
            if (task.folder() != TaskFolder.TASKS) {
                throw new IllegalStateException("Only tasks can be completed, " + task.id() + " is a draft");
            }
            Path moved = move(task, TaskFolder.COMPLETED);
            log.info("Completed {}", task.id());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.COMPLETED, task.id(), moved));
            return moved;
        } finally {
            MdcContext.clear();
        }
    }

    /** Permanently removes the record file, whatever folder it is in. */
    public void deleteTask(String taskId) {
        MdcContext.setOperation("delete", taskId);
        try {
            Task task = repository.get(taskId).task();
            try {
                Files.delete(task.filePath());
            } catch (IOException e) {
                throw new StoreIoException("Failed to delete " + task.filePath(), e);
            }
            repository.invalidate(task.filePath());
            log.info("Deleted {}", task.id());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.DELETED, task.id(), null));
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Turns a draft into a task: a fresh task id, the initial status, a file in
     * {@code tasks/}. The draft file is removed once the task is written.
     */
    public CreatedTask promoteDraft(String draftId) {
        MdcContext.setOperation("promote", draftId);
        try {
            TaskSnapshot snapshot = repository.get(draftId);
            Task draft = requireWritable(snapshot.task());
            if (draft.folder() != TaskFolder.DRAFTS) {
                throw new IllegalStateException(draft.id() + " is not a draft");
            }
            BacklogConfig config = repository.config();
            BacklogPaths paths = repository.paths();
            List<Path> existing = TaskFiles.listAll(List.of(paths.folder(TaskFolder.TASKS),
                    paths.folder(TaskFolder.COMPLETED), paths.folder(TaskFolder.ARCHIVE_TASKS)));
            String id = config.idPrefix() + "-" + (TaskFiles.highestNumber(existing, config.taskPrefix()) + 1);

            CreatedTask created = rewriteInto(snapshot, id, config.initialStatus(), TaskFolder.TASKS);
            log.info("Promoted {} to {}", draft.id(), id);
            eventBus.publish(TaskEvent.of(TaskEvent.Type.PROMOTED, id, created.path()));
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    /** Turns a task back into a draft with a fresh draft id. */
    public CreatedTask demoteTask(String taskId) {
        MdcContext.setOperation("demote", taskId);
        try {
            TaskSnapshot snapshot = repository.get(taskId);
            Task task = requireWritable(snapshot.task());
            if (task.folder() != TaskFolder.TASKS) {
                throw new IllegalStateException(task.id() + " is already a draft");
            }
            CreatedTask created = rewriteInto(snapshot, nextDraftId(), TaskCodec.DRAFT_STATUS, TaskFolder.DRAFTS);
            log.info("Demoted {} to {}", task.id(), created.id());
            eventBus.publish(TaskEvent.of(TaskEvent.Type.DEMOTED, created.id(), created.path()));
            return created;
        } finally {
            MdcContext.clear();
        }
    }

    // -- helpers ---------------------------------------------------------------------------------

    /** Writes the record under a new id and folder, then removes the old file. */
    private CreatedTask rewriteInto(TaskSnapshot snapshot, String id, String status, TaskFolder folder) {
        Task task = snapshot.task();
        TaskUpdate changes = TaskUpdate.builder().status(status).build().with(HeaderField.ID, id);
        String content = TaskCodec.applyUpdate(snapshot.content(), task.filePath(), id, changes);
        Path file = repository.paths().folder(folder).resolve(TaskFiles.fileName(id, task.title()));

        conflictDetector.verify(task.filePath(), snapshot.token());
        WriteResult result = conflictDetector.write(file, content);
        try {
            Files.delete(task.filePath());
        } catch (IOException e) {
            throw new StoreIoException("Wrote " + file + " but failed to remove " + task.filePath(), e);
        }
        repository.invalidate(task.filePath());
        repository.invalidate(file);
        return new CreatedTask(id, file, result.token());
    }

    private Path move(Task task, TaskFolder target) {
        Path source = task.filePath();
        Path destination = repository.paths().folder(target).resolve(source.getFileName());
        try {
            Files.createDirectories(destination.getParent());
            Files.move(source, destination);
        } catch (IOException e) {
            throw new StoreIoException("Failed to move " + source + " to " + target.relativePath(), e);
        }
        repository.invalidate(source);
        return destination;
    }

    private String nextDraftId() {
        BacklogPaths paths = repository.paths();
        List<Path> drafts = TaskFiles.listAll(List.of(paths.folder(TaskFolder.DRAFTS),
                paths.folder(TaskFolder.ARCHIVE_DRAFTS)));
        return DRAFT_PREFIX.toUpperCase(Locale.ROOT) + "-" + (TaskFiles.highestNumber(drafts, DRAFT_PREFIX) + 1);
    }

    private static Task requireWritable(Task task) {
        if (!task.isWritable()) {
            throw new ReadOnlyTaskException(task.id(),
                    "it is in " + (task.folder() == null ? "an unknown folder" : task.folder().relativePath()));
        }
        return task;
    }

    private static String requireTitle(TaskUpdate fields) {
        String title = fields.string(HeaderField.TITLE);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("A task needs a title");
        }
        return title.trim();
    }
}
