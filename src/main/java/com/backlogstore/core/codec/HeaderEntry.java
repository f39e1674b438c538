package com.backlogstore.core.codec;

/**
 * One top-level header key with its continuation lines (block list items,
 * comments, blank lines that follow it).
 *
 * @param key top-level key as spelled in the file; {@code null} for lines before the first key
 * @param raw exact source text of all lines, terminators included
 */
public record HeaderEntry(String key, String raw) {
}
