package com.backlogstore.core.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lenient coercion of decoded header values. YAML gives us strings, numbers,
 * booleans, lists or maps depending on how a value was written; readers only
 * ever want strings and string lists.
 */
final class HeaderValues {

    private HeaderValues() {
    }

    /** Value of the first spelling present, compared case-insensitively, in spelling order. */
    static Object lookup(Map<String, Object> values, List<String> spellings) {
        for (String spelling : spellings) {
            for (Map.Entry<String, Object> entry : values.entrySet()) {
                if (entry.getKey() != null
                        && entry.getKey().toLowerCase(Locale.ROOT).equals(spelling.toLowerCase(Locale.ROOT))
                        && entry.getValue() != null) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    /** Trimmed string form, {@code null} for absent or blank values. */
    static String string(Object value) {
        if (value == null || value instanceof Collection<?> || value instanceof Map<?, ?>) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    /** A list, or a single scalar promoted to a one-element list. Blank items are dropped. */
    static List<String> list(Object value) {
        var items = new ArrayList<String>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                String text = string(item);
                if (text != null) {
                    items.add(text);
                }
            }
        } else {
            String text = string(value);
            if (text != null) {
                items.add(text);
            }
        }
        return items;
    }

    static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    /** Order-preserving de-duplication. */
    static List<String> distinct(List<String> values) {
        return new ArrayList<>(new LinkedHashSet<>(values));
    }
}
