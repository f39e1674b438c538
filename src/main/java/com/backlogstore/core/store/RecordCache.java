package com.backlogstore.core.store;

import com.backlogstore.core.model.Task;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsed records keyed by path. An entry is valid only while the file's
 * modification time and size are unchanged and the statuses it was parsed
 * against are still the configured ones.
 */
public class RecordCache {

    private final ConcurrentHashMap<Path, Entry> entries = new ConcurrentHashMap<>();

    public Entry get(Path path, FileTime modified, long size, List<String> statuses) {
        Entry entry = entries.get(path);
        if (entry == null || !entry.modified().equals(modified) || entry.size() != size
                || !entry.statuses().equals(statuses)) {
            return null;
        }
        return entry;
    }

    public void put(Path path, Entry entry) {
        entries.put(path, entry);
    }

    public void invalidate(Path path) {
        entries.remove(path);
    }

    public void invalidateAll() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * @param task    parsed record
     * @param content exact text it was parsed from
     * @param token   state token of {@code content}
     */
    public record Entry(FileTime modified, long size, List<String> statuses,
                        Task task, String content, String token) {
    }
}
