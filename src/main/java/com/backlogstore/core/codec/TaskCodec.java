package com.backlogstore.core.codec;

import com.backlogstore.core.error.MalformedRecordException;
import com.backlogstore.core.error.TaskNotFoundException;
import com.backlogstore.core.model.BodyField;
import com.backlogstore.core.model.ChecklistItem;
import com.backlogstore.core.model.ChecklistKind;
import com.backlogstore.core.model.HeaderField;
import com.backlogstore.core.model.Priority;
import com.backlogstore.core.model.Task;
import com.backlogstore.core.model.TaskFolder;
import com.backlogstore.core.model.TaskSource;
import com.backlogstore.core.model.TaskUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts task record text to {@link Task} and applies {@link TaskUpdate}s
 * back onto the text.
 *
 * <p>Reading is lenient: a missing or unparseable header yields a minimal
 * task (id from the file name, title from the first heading, default
 * status). Writing is strict and throws {@link MalformedRecordException}
 * when the header cannot be decoded. Writes touch only the header entries
 * and body sections named in the update; every other byte is kept.
 */
public final class TaskCodec {

    private static final Logger log = LoggerFactory.getLogger(TaskCodec.class);

    public static final String DRAFT_STATUS = "Draft";

    private static final Pattern FILE_ID = Pattern.compile("^([A-Za-z]+-\\d+(?:\\.\\d+)*)");
    private static final Pattern STATUS_GLYPH = Pattern.compile("^[○◒●◑]\\s*");
    private static final Pattern TITLE_HEADING = Pattern.compile("^#[ \\t]+(.+?)\\s*$");
    private static final Pattern TITLE_ID_PREFIX = Pattern.compile("^[A-Za-z]+-\\d+(?:\\.\\d+)*\\s*-\\s*");

    /** Lists always written to a new record, even when empty. */
    private static final List<HeaderField> ALWAYS_WRITTEN =
            List.of(HeaderField.LABELS, HeaderField.ASSIGNEE, HeaderField.DEPENDENCIES);

    private TaskCodec() {
    }

    public static MarkdownRecord split(String content) {
        return RecordParser.parse(content, SectionKind::forTaskHeading);
    }

    // -- reading ---------------------------------------------------------------------------------

    /**
     * Parses a task record. Never throws for content problems.
     *
     * @param statuses configured statuses, first one is the default
     */
    public static Task decode(String content, Path file, TaskFolder folder,
                              List<String> statuses, Instant lastModified) {
        MarkdownRecord record = split(content);
        Map<String, Object> values = Map.of();
        if (record.header().isPresent()) {
            try {
                values = HeaderYaml.decode(record.header().get().innerText());
            } catch (JsonProcessingException e) {
                log.warn("Unparseable header in {}, reading it as a minimal record: {}",
                        file, e.getOriginalMessage());
            }
        }

        String id = string(values, HeaderField.ID);
        id = id != null ? id.toUpperCase(Locale.ROOT) : idFromFileName(file);
        String title = string(values, HeaderField.TITLE);
        if (title == null) {
            title = titleFromBody(record);
        }
        if (title == null) {
            title = id;
        }
        String status = folder != null && folder.isDraftFamily()
                ? DRAFT_STATUS
                : normalizeStatus(string(values, HeaderField.STATUS), statuses);

        List<ChecklistItem> acceptance = record.span(SectionKind.ACCEPTANCE_CRITERIA)
                .map(SectionEditor::checklist).orElse(List.of());
        List<ChecklistItem> done = record.span(SectionKind.DEFINITION_OF_DONE)
                .map(SectionEditor::checklist).orElse(List.of());

        return new Task(
                id,
                title,
                status,
                Priority.parse(string(values, HeaderField.PRIORITY)),
                list(values, HeaderField.LABELS),
                list(values, HeaderField.ASSIGNEE),
                string(values, HeaderField.REPORTER),
                string(values, HeaderField.MILESTONE),
                list(values, HeaderField.DEPENDENCIES),
                string(values, HeaderField.PARENT_TASK_ID),
                list(values, HeaderField.SUBTASKS),
                list(values, HeaderField.REFERENCES),
                list(values, HeaderField.DOCUMENTATION),
                HeaderValues.number(HeaderValues.lookup(values, HeaderField.ORDINAL.spellings())),
                string(values, HeaderField.TYPE),
                sectionText(record, SectionKind.DESCRIPTION),
                acceptance,
                done,
                sectionText(record, SectionKind.IMPLEMENTATION_PLAN),
                sectionText(record, SectionKind.IMPLEMENTATION_NOTES),
                sectionText(record, SectionKind.FINAL_SUMMARY),
                string(values, HeaderField.ON_STATUS_CHANGE),
                DateValues.normalize(string(values, HeaderField.CREATED_DATE)),
                DateValues.normalize(string(values, HeaderField.UPDATED_DATE)),
                TaskSource.LOCAL,
                null,
                folder,
                file,
                lastModified);
    }

    /** {@code TASK-12} from {@code task-12 - Some-Title.md}; the bare name when there is no id prefix. */
    public static String idFromFileName(Path file) {
        String name = file.getFileName().toString();
        if (name.endsWith(".md")) {
            name = name.substring(0, name.length() - 3);
        }
        Matcher m = FILE_ID.matcher(name);
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : name;
    }

    /**
     * Strips progress glyphs and matches the configured statuses
     * case-insensitively. Unknown values are kept as written; a missing value
     * becomes the first configured status.
     */
    public static String normalizeStatus(String raw, List<String> statuses) {
        String fallback = statuses.isEmpty() ? "To Do" : statuses.get(0);
        if (raw == null) {
            return fallback;
        }
        String clean = STATUS_GLYPH.matcher(raw.trim()).replaceFirst("").trim();
        if (clean.isEmpty()) {
            return fallback;
        }
        for (String status : statuses) {
            if (status.equalsIgnoreCase(clean)) {
                return status;
            }
        }
        if (DRAFT_STATUS.equalsIgnoreCase(clean)) {
            return DRAFT_STATUS;
        }
        return clean;
    }

    private static String titleFromBody(MarkdownRecord record) {
        var fence = new RecordParser.FenceTracker();
        for (String line : Lines.split(record.body())) {
            String content = Lines.content(line);
            if (fence.update(content)) {
                continue;
            }
            Matcher m = TITLE_HEADING.matcher(content.trim());
            if (m.matches()) {
                String title = TITLE_ID_PREFIX.matcher(m.group(1)).replaceFirst("").trim();
                return title.isEmpty() ? null : title;
            }
        }
        return null;
    }

    private static String sectionText(MarkdownRecord record, SectionKind kind) {
        return record.span(kind).flatMap(SectionEditor::text).orElse(null);
    }

    private static String string(Map<String, Object> values, HeaderField field) {
        return HeaderValues.string(HeaderValues.lookup(values, field.spellings()));
    }

    private static List<String> list(Map<String, Object> values, HeaderField field) {
        return HeaderValues.list(HeaderValues.lookup(values, field.spellings()));
    }

    // -- writing ---------------------------------------------------------------------------------

    /**
     * Splits the record and checks that its header decodes.
     *
     * @throws MalformedRecordException when a header is present but is not valid YAML
     */
    public static MarkdownRecord parseForWrite(String content, Path file) {
        MarkdownRecord record = split(content);
        if (record.header().isPresent()) {
            try {
                HeaderYaml.decode(record.header().get().innerText());
            } catch (JsonProcessingException e) {
                throw new MalformedRecordException(file,
                        "Header of " + file + " is not valid YAML: " + e.getOriginalMessage(), e);
            }
        }
        return record;
    }

    /**
     * Applies an update to existing record text.
     *
     * @param taskId id of the record, used to keep it out of its own dependencies
     * @return the new record text
     */
    public static String applyUpdate(String content, Path file, String taskId, TaskUpdate update) {
        MarkdownRecord record = parseForWrite(content, file);

        for (Map.Entry<HeaderField, Object> change : update.headerChanges().entrySet()) {
            record = RecordEditor.setHeaderField(record, change.getKey(),
                    headerValue(change.getKey(), change.getValue(), taskId));
        }
        for (Map.Entry<BodyField, String> change : update.bodyChanges().entrySet()) {
            record = RecordEditor.setSection(record, sectionKind(change.getKey()), change.getValue(),
                    SectionKind.TASK_ORDER, SectionKind::forTaskHeading);
        }
        for (Map.Entry<ChecklistKind, List<ChecklistItem>> change : update.checklistChanges().entrySet()) {
            SectionKind kind = sectionKind(change.getKey());
            List<ChecklistItem> existing = record.span(kind).map(SectionEditor::checklist).orElse(List.of());
            List<ChecklistItem> items = numberNewItems(existing, change.getValue());
            record = RecordEditor.setSection(record, kind, SectionEditor.renderChecklist(items, record.newline()),
                    SectionKind.TASK_ORDER, SectionKind::forTaskHeading);
        }
        return record.render();
    }

    /**
     * Flips the checkbox of item {@code itemId} in one checklist. Every line
     * carrying that id is flipped.
     *
     * @throws TaskNotFoundException when no line in that checklist has the id
     */
    public static String toggleChecklist(String content, Path file, String taskId, ChecklistKind kind, int itemId) {
        MarkdownRecord record = parseForWrite(content, file);
        SectionKind sectionKind = sectionKind(kind);
        List<BodySpan> spans = new ArrayList<>(record.spans());
        for (int i = 0; i < spans.size(); i++) {
            if (spans.get(i).kind() != sectionKind) {
                continue;
            }
            SectionEditor.ToggleResult result = SectionEditor.toggle(spans.get(i), itemId);
            if (result.toggled() == 0) {
                break;
            }
            if (result.toggled() > 1) {
                log.warn("Checklist item #{} appears {} times in {} of {}, toggled all of them",
                        itemId, result.toggled(), kind, taskId);
            }
            spans.set(i, result.span());
            return record.withSpans(spans).render();
        }
        throw new TaskNotFoundException(taskId,
                "Checklist item #" + itemId + " not found in " + kind + " of " + taskId);
    }

    /**
     * Text of a brand-new record: header in canonical order, then a
     * Description section and whatever body sections {@code fields} sets.
     */
    public static String encodeNew(String id, String status, String createdDate, TaskUpdate fields) {
        String nl = "\n";
        var header = new StringBuilder(HeaderBlock.DELIMITER).append(nl);
        for (HeaderField field : HeaderField.values()) {
            Object value = switch (field) {
                case ID -> id;
                case STATUS -> status;
                case CREATED_DATE -> fields.sets(field) ? fields.headerChanges().get(field) : createdDate;
                default -> fields.headerChanges().get(field);
            };
            if (field.isList()) {
                value = headerValue(field, value == null ? List.of() : value, id);
                if (((List<?>) value).isEmpty() && !ALWAYS_WRITTEN.contains(field)) {
                    continue;
                }
            } else if (value == null) {
                continue;
            }
            header.append(HeaderEditor.renderLine(field, field.key(), value, nl));
        }
        header.append(HeaderBlock.DELIMITER).append(nl);

        TaskUpdate body = fields.bodyChanges().containsKey(BodyField.DESCRIPTION)
                ? fields.bodyOnly()
                : fields.toBuilder().description("").build().bodyOnly();
        return applyUpdate(header.toString(), Path.of(id + ".md"), id, body);
    }

    /** Coerces an update value to what the header line should hold. */
    @SuppressWarnings("unchecked")
    private static Object headerValue(HeaderField field, Object value, String taskId) {
        if (!field.isList() || value == null) {
            return value;
        }
        List<String> items = HeaderValues.distinct((List<String>) value);
        if (field == HeaderField.DEPENDENCIES) {
            items.removeIf(dependency -> dependency.equalsIgnoreCase(taskId));
        }
        return items;
    }

    /** Gives id {@code 0} items the next free numbers; existing ids are never reused. */
    private static List<ChecklistItem> numberNewItems(List<ChecklistItem> existing, List<ChecklistItem> requested) {
        int max = 0;
        for (ChecklistItem item : existing) {
            max = Math.max(max, item.id());
        }
        for (ChecklistItem item : requested) {
            max = Math.max(max, item.id());
        }
        var items = new ArrayList<ChecklistItem>();
        for (ChecklistItem item : requested) {
            items.add(item.id() > 0 ? item : new ChecklistItem(++max, item.text(), item.checked()));
        }
        return items;
    }

    static SectionKind sectionKind(BodyField field) {
        return switch (field) {
            case DESCRIPTION -> SectionKind.DESCRIPTION;
            case IMPLEMENTATION_PLAN -> SectionKind.IMPLEMENTATION_PLAN;
            case IMPLEMENTATION_NOTES -> SectionKind.IMPLEMENTATION_NOTES;
            case FINAL_SUMMARY -> SectionKind.FINAL_SUMMARY;
        };
    }

    static SectionKind sectionKind(ChecklistKind kind) {
        return kind == ChecklistKind.ACCEPTANCE_CRITERIA
                ? SectionKind.ACCEPTANCE_CRITERIA
                : SectionKind.DEFINITION_OF_DONE;
    }
}
