package com.backlogstore.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Known task header keys, declared in canonical emission order.
 * Keys not listed here are kept verbatim after the known ones.
 */
public enum HeaderField {
    ID("id", false),
    TITLE("title", false),
    STATUS("status", false),
    PRIORITY("priority", false),
    MILESTONE("milestone", false),
    LABELS("labels", true),
    ASSIGNEE("assignee", true, "assignees"),
    REPORTER("reporter", false),
    CREATED_DATE("created_date", false, "created"),
    UPDATED_DATE("updated_date", false, "updated"),
    DEPENDENCIES("dependencies", true),
    REFERENCES("references", true),
    DOCUMENTATION("documentation", true),
    PARENT_TASK_ID("parent_task_id", false, "parent"),
    SUBTASKS("subtasks", true),
    TYPE("type", false),
    ORDINAL("ordinal", false),
    ON_STATUS_CHANGE("onStatusChange", false);

    private final String key;
    private final boolean list;
    private final List<String> aliases;

    HeaderField(String key, boolean list, String... aliases) {
        this.key = key;
        this.list = list;
        this.aliases = List.of(aliases);
    }

    /** Preferred spelling used when the field is first written. */
    public String key() {
        return key;
    }

    public boolean isList() {
        return list;
    }

    /** Every spelling that maps to this field, preferred first. */
    public List<String> spellings() {
        var all = new ArrayList<String>();
        all.add(key);
        all.addAll(aliases);
        return all;
    }

    public boolean matches(String headerKey) {
        if (headerKey == null) {
            return false;
        }
        String lower = headerKey.toLowerCase(Locale.ROOT);
        if (key.toLowerCase(Locale.ROOT).equals(lower)) {
            return true;
        }
        return aliases.contains(lower);
    }

    /** Resolves a header key, alias included; {@code null} for unknown keys. */
    public static HeaderField forKey(String headerKey) {
        for (HeaderField field : values()) {
            if (field.matches(headerKey)) {
                return field;
            }
        }
        return null;
    }
}
