package com.backlogstore.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A partial set of task fields. A field that was set is written; a field that
 * was cleared is removed from the header (scalars) or emptied (lists); every
 * other field is left exactly as it is in the file.
 *
 * <p>Also serves as the field set for creating a task.
 */
public final class TaskUpdate {

    private final Map<HeaderField, Object> header;
    private final Map<BodyField, String> body;
    private final Map<ChecklistKind, List<ChecklistItem>> checklists;

    private TaskUpdate(Builder builder) {
        this.header = Collections.unmodifiableMap(new EnumMap<>(builder.header));
        this.body = Collections.unmodifiableMap(new EnumMap<>(builder.body));
        this.checklists = Collections.unmodifiableMap(new EnumMap<>(builder.checklists));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Header changes. Values are {@code String}, {@code List<String>} or
     * {@code Double}; a {@code null} value means the field is cleared.
     */
    public Map<HeaderField, Object> headerChanges() {
        return header;
    }

    public Map<BodyField, String> bodyChanges() {
        return body;
    }

    public Map<ChecklistKind, List<ChecklistItem>> checklistChanges() {
        return checklists;
    }

    public boolean sets(HeaderField field) {
        return header.containsKey(field);
    }

    public String string(HeaderField field) {
        Object value = header.get(field);
        return value instanceof String s ? s : null;
    }

    @SuppressWarnings("unchecked")
    public List<String> list(HeaderField field) {
        Object value = header.get(field);
        return value instanceof List<?> l ? (List<String>) l : List.of();
    }

    public boolean isEmpty() {
        return header.isEmpty() && body.isEmpty() && checklists.isEmpty();
    }

    /** Returns a copy of this update with one more header change. */
    public TaskUpdate with(HeaderField field, Object value) {
        var builder = toBuilder();
        builder.header.put(field, value);
        return builder.build();
    }

    /** Returns a copy of this update without the given header change. */
    public TaskUpdate without(HeaderField field) {
        var builder = toBuilder();
        builder.header.remove(field);
        return builder.build();
    }

    /** Body and checklist changes only, header changes dropped. */
    public TaskUpdate bodyOnly() {
        var builder = toBuilder();
        builder.header.clear();
        return builder.build();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.header.putAll(header);
        builder.body.putAll(body);
        builder.checklists.putAll(checklists);
        return builder;
    }

    @Override
    public String toString() {
        return "TaskUpdate{header=" + header.keySet() + ", body=" + body.keySet()
                + ", checklists=" + checklists.keySet() + "}";
    }

    public static final class Builder {

        private final Map<HeaderField, Object> header = new EnumMap<>(HeaderField.class);
        private final Map<BodyField, String> body = new EnumMap<>(BodyField.class);
        private final Map<ChecklistKind, List<ChecklistItem>> checklists = new EnumMap<>(ChecklistKind.class);

        private Builder() {
        }

        public Builder title(String title) {
            header.put(HeaderField.TITLE, title);
            return this;
        }

        public Builder status(String status) {
            header.put(HeaderField.STATUS, status);
            return this;
        }

        public Builder priority(Priority priority) {
            header.put(HeaderField.PRIORITY, priority == null ? null : priority.wireValue());
            return this;
        }

        public Builder milestone(String milestone) {
            header.put(HeaderField.MILESTONE, milestone);
            return this;
        }

        public Builder labels(List<String> labels) {
            header.put(HeaderField.LABELS, List.copyOf(labels));
            return this;
        }

        public Builder assignee(List<String> assignee) {
            header.put(HeaderField.ASSIGNEE, List.copyOf(assignee));
            return this;
        }

        public Builder reporter(String reporter) {
            header.put(HeaderField.REPORTER, reporter);
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            header.put(HeaderField.DEPENDENCIES, List.copyOf(dependencies));
            return this;
        }

        public Builder references(List<String> references) {
            header.put(HeaderField.REFERENCES, List.copyOf(references));
            return this;
        }

        public Builder documentation(List<String> documentation) {
            header.put(HeaderField.DOCUMENTATION, List.copyOf(documentation));
            return this;
        }

        public Builder parentTaskId(String parentTaskId) {
            header.put(HeaderField.PARENT_TASK_ID, parentTaskId);
            return this;
        }

        public Builder type(String type) {
            header.put(HeaderField.TYPE, type);
            return this;
        }

        public Builder ordinal(Double ordinal) {
            header.put(HeaderField.ORDINAL, ordinal);
            return this;
        }

        public Builder createdDate(String createdDate) {
            header.put(HeaderField.CREATED_DATE, createdDate);
            return this;
        }

        public Builder updatedDate(String updatedDate) {
            header.put(HeaderField.UPDATED_DATE, updatedDate);
            return this;
        }

        public Builder onStatusChange(String command) {
            header.put(HeaderField.ON_STATUS_CHANGE, command);
            return this;
        }

        /** Removes a scalar field or empties a list field. */
        public Builder clear(HeaderField field) {
            header.put(field, field.isList() ? List.of() : null);
            return this;
        }

        public Builder description(String description) {
            body.put(BodyField.DESCRIPTION, description);
            return this;
        }

        public Builder implementationPlan(String plan) {
            body.put(BodyField.IMPLEMENTATION_PLAN, plan);
            return this;
        }

        public Builder implementationNotes(String notes) {
            body.put(BodyField.IMPLEMENTATION_NOTES, notes);
            return this;
        }

        public Builder finalSummary(String summary) {
            body.put(BodyField.FINAL_SUMMARY, summary);
            return this;
        }

        /**
         * Replaces a whole checklist. Items with id {@code 0} are new and get the
         * next free number; other ids are kept as given.
         */
        public Builder checklist(ChecklistKind kind, List<ChecklistItem> items) {
            checklists.put(kind, List.copyOf(items));
            return this;
        }

        /** Convenience for new, unchecked items. */
        public Builder checklistTexts(ChecklistKind kind, List<String> texts) {
            var items = new ArrayList<ChecklistItem>();
            for (String text : texts) {
                items.add(new ChecklistItem(0, text, false));
            }
            return checklist(kind, items);
        }

        public TaskUpdate build() {
            return new TaskUpdate(this);
        }
    }
}
