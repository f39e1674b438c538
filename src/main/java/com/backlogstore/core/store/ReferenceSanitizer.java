package com.backlogstore.core.store;

import com.backlogstore.core.codec.TaskCodec;
import com.backlogstore.core.conflict.ConflictDetector;
import com.backlogstore.core.error.TaskConflictException;
import com.backlogstore.core.events.TaskEvent;
import com.backlogstore.core.events.TaskEventBus;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskSnapshot;
import com.backlogstore.core.model.TaskUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes an archived task's id from the {@code dependencies} and
 * {@code references} of active tasks.
 *
 * <p>Matching is exact: a dependency must equal the id, a reference must equal
 * it ignoring case. {@code TASK-90} or a URL containing {@code task-9} is never
 * touched when {@code TASK-9} is archived. Each rewrite goes through the
 * conflict detector with the token of the content just read; a record that
 * changed in between is reported, not retried.
 */
public class ReferenceSanitizer {

    private static final Logger log = LoggerFactory.getLogger(ReferenceSanitizer.class);

    private final TaskRepository repository;
    private final ConflictDetector conflictDetector;
    private final TaskEventBus eventBus;

    public ReferenceSanitizer(TaskRepository repository, ConflictDetector conflictDetector, TaskEventBus eventBus) {
        this.repository = repository;
        this.conflictDetector = conflictDetector;
        this.eventBus = eventBus;
    }

    public SanitizeResult sanitize(String archivedId) {
        var updated = new ArrayList<String>();
        var conflicted = new ArrayList<String>();

        for (TaskSnapshot snapshot : repository.listSnapshots(TaskFolder.TASKS)) {
            Task task = snapshot.task();
            List<String> dependencies = new ArrayList<>(task.dependencies());
            List<String> references = new ArrayList<>(task.references());
            boolean dependencyRemoved = dependencies.removeIf(archivedId::equals);
            boolean referenceRemoved = references.removeIf(archivedId::equalsIgnoreCase);
            if (!dependencyRemoved && !referenceRemoved) {
                continue;
            }

            var update = TaskUpdate.builder();
            if (dependencyRemoved) {
                update.dependencies(dependencies);
            }
            if (referenceRemoved) {
                update.references(references);
            }
            TaskUpdate changes = update.build();
            try {
                conflictDetector.checkedWrite(task.filePath(), snapshot.token(),
                        current -> TaskCodec.applyUpdate(current, task.filePath(), task.id(), changes));
                repository.invalidate(task.filePath());
                updated.add(task.id());
                eventBus.publish(TaskEvent.of(TaskEvent.Type.SANITIZED, task.id(), task.filePath()));
            } catch (TaskConflictException e) {
                log.warn("{} changed while removing references to {}, left as is", task.id(), archivedId);
                conflicted.add(task.id());
            }
        }

        if (!updated.isEmpty() || !conflicted.isEmpty()) {
            log.info("Removed {} from {} task(s), {} conflict(s)", archivedId, updated.size(), conflicted.size());
        }
        return new SanitizeResult(updated, conflicted);
    }
}
