package com.backlogstore.core.codec;

import com.backlogstore.core.model.HeaderField;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces, inserts or removes single header entries. An existing key keeps
 * its spelling and position; a new key goes after the last known key that
 * precedes it in {@link HeaderField} order.
 */
final class HeaderEditor {

    private HeaderEditor() {
    }

    /**
     * Applies one field change.
     *
     * @param value {@code String}, {@code List<String>}, {@code Number}, or {@code null} to remove
     */
    static HeaderBlock apply(HeaderBlock header, HeaderField field, Object value, String newline) {
        var entries = new ArrayList<>(header.entries());
        int index = header.indexOf(field);

        if (value == null && !field.isList()) {
            if (index >= 0) {
                String trivia = trailingTrivia(entries.get(index).raw());
                if (trivia.isEmpty()) {
                    entries.remove(index);
                } else {
                    entries.set(index, new HeaderEntry(null, trivia));
                }
            }
            return header.withEntries(entries);
        }

        String key = index >= 0 ? entries.get(index).key() : field.key();
        if (index >= 0) {
            String trivia = trailingTrivia(entries.get(index).raw());
            entries.set(index, new HeaderEntry(key, renderLine(field, key, value, newline) + trivia));
        } else {
            var entry = new HeaderEntry(key, renderLine(field, key, value, newline));
            entries.add(insertionPoint(entries, field), entry);
        }
        return header.withEntries(entries);
    }

    /** Comment and blank lines closing an entry; they are not part of its value and outlive a rewrite. */
    static String trailingTrivia(String raw) {
        List<String> lines = Lines.split(raw);
        int start = lines.size();
        while (start > 1) {
            String content = Lines.content(lines.get(start - 1));
            if (!content.isBlank() && !content.stripLeading().startsWith("#")) {
                break;
            }
            start--;
        }
        return Lines.join(lines.subList(start, lines.size()));
    }

    @SuppressWarnings("unchecked")
    static String renderLine(HeaderField field, String key, Object value, String newline) {
        if (field.isList()) {
            List<String> items = value == null ? List.of() : (List<String>) value;
            return HeaderYaml.listLine(key, items, newline);
        }
        if (value instanceof Number number) {
            return HeaderYaml.numberLine(key, number.doubleValue(), newline);
        }
        return HeaderYaml.scalarLine(key, String.valueOf(value), newline);
    }

    private static int insertionPoint(List<HeaderEntry> entries, HeaderField field) {
        int after = -1;
        for (int i = 0; i < entries.size(); i++) {
            HeaderField existing = HeaderField.forKey(entries.get(i).key());
            if (existing != null && existing.ordinal() < field.ordinal()) {
                after = i;
            }
        }
        if (after >= 0) {
            return after + 1;
        }
        // Nothing known precedes it: go after leading comment lines, before the first key.
        int i = 0;
        while (i < entries.size() && entries.get(i).key() == null) {
            i++;
        }
        return i;
    }
}
