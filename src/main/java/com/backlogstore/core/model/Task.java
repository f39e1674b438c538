package com.backlogstore.core.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A task record as parsed from one file (or one branch snapshot of it).
 *
 * @param id                 e.g. {@code TASK-5} or {@code TASK-5.2} for a subtask
 * @param title              title from the header, or the first heading as fallback
 * @param status             one of the configured statuses, or {@code Draft}
 * @param priority           nullable
 * @param labels             ordered, de-duplicated on write
 * @param assignee           ordered; values may carry an {@code @}
 * @param reporter           nullable
 * @param milestone          nullable
 * @param dependencies       ids of tasks that block this one
 * @param parentTaskId       nullable
 * @param subtasks           ids of children, computed from {@code parentTaskId} links
 * @param references         opaque strings (URLs, paths, ids)
 * @param documentation      opaque strings (URLs, paths)
 * @param ordinal            sort key within the status group, nullable
 * @param type               free-form task type, nullable
 * @param description        text of the Description section, nullable
 * @param acceptanceCriteria checklist items
 * @param definitionOfDone   checklist items
 * @param implementationPlan nullable
 * @param implementationNotes nullable
 * @param finalSummary       nullable
 * @param onStatusChange     per-task status hook command, nullable
 * @param createdDate        {@code YYYY-MM-DD} or {@code YYYY-MM-DD HH:MM}, nullable
 * @param updatedDate        same formats as {@code createdDate}, nullable
 * @param source             provenance of this snapshot
 * @param branch             branch name when not read from the working tree
 * @param folder             logical folder the file lives in
 * @param filePath           backing file (for branch snapshots, the path it would have locally)
 * @param lastModified       modification time used by reconciliation, nullable
 */
public record Task(
        String id,
        String title,
        String status,
        Priority priority,
        List<String> labels,
        List<String> assignee,
        String reporter,
        String milestone,
        List<String> dependencies,
        String parentTaskId,
        List<String> subtasks,
        List<String> references,
        List<String> documentation,
        Double ordinal,
        String type,
        String description,
        List<ChecklistItem> acceptanceCriteria,
        List<ChecklistItem> definitionOfDone,
        String implementationPlan,
        String implementationNotes,
        String finalSummary,
        String onStatusChange,
        String createdDate,
        String updatedDate,
        TaskSource source,
        String branch,
        TaskFolder folder,
        Path filePath,
        Instant lastModified
) {

    public Task {
        labels = List.copyOf(labels);
        assignee = List.copyOf(assignee);
        dependencies = List.copyOf(dependencies);
        subtasks = List.copyOf(subtasks);
        references = List.copyOf(references);
        documentation = List.copyOf(documentation);
        acceptanceCriteria = List.copyOf(acceptanceCriteria);
        definitionOfDone = List.copyOf(definitionOfDone);
    }

    /** Only working-tree records in an editable folder may be written. */
    public boolean isWritable() {
        return source == TaskSource.LOCAL && folder != null && folder.isWritable();
    }

    public List<ChecklistItem> checklist(ChecklistKind kind) {
        return kind == ChecklistKind.ACCEPTANCE_CRITERIA ? acceptanceCriteria : definitionOfDone;
    }

    public Task withProvenance(TaskSource newSource, String newBranch, Instant newLastModified) {
        return new Task(id, title, status, priority, labels, assignee, reporter, milestone,
                dependencies, parentTaskId, subtasks, references, documentation, ordinal, type,
                description, acceptanceCriteria, definitionOfDone, implementationPlan,
                implementationNotes, finalSummary, onStatusChange, createdDate, updatedDate,
                newSource, newBranch, folder, filePath, newLastModified);
    }

    public Task withSubtasks(List<String> newSubtasks) {
        return new Task(id, title, status, priority, labels, assignee, reporter, milestone,
                dependencies, parentTaskId, newSubtasks, references, documentation, ordinal, type,
                description, acceptanceCriteria, definitionOfDone, implementationPlan,
                implementationNotes, finalSummary, onStatusChange, createdDate, updatedDate,
                source, branch, folder, filePath, lastModified);
    }

    public Task withStatus(String newStatus) {
        return new Task(id, title, newStatus, priority, labels, assignee, reporter, milestone,
                dependencies, parentTaskId, subtasks, references, documentation, ordinal, type,
                description, acceptanceCriteria, definitionOfDone, implementationPlan,
                implementationNotes, finalSummary, onStatusChange, createdDate, updatedDate,
                source, branch, folder, filePath, lastModified);
    }
}
