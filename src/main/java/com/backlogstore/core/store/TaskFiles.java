package com.backlogstore.core.store;

import com.backlogstore.core.error.StoreIoException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * File naming and directory listing for record files.
 */
public final class TaskFiles {

    private static final Pattern UNSAFE = Pattern.compile("[^\\p{L}\\p{N}\\s_-]");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");

    private TaskFiles() {
    }

    /**
     * File-name form of a title: punctuation dropped, runs of spaces, dashes
     * and underscores collapsed to one dash. {@code "Fix: bug #123 (urgent!)"}
     * becomes {@code "Fix-bug-123-urgent"}.
     */
    public static String sanitizeTitle(String title) {
        String cleaned = UNSAFE.matcher(title).replaceAll("");
        String dashed = SEPARATORS.matcher(cleaned.trim()).replaceAll("-");
        dashed = dashed.replaceAll("^-+|-+$", "");
        if (dashed.length() > 100) {
            dashed = dashed.substring(0, 100).replaceAll("-+$", "");
        }
        return dashed.isEmpty() ? "untitled" : dashed;
    }

    /** {@code task-7 - Fix-bug.md} for id {@code TASK-7}. */
    public static String fileName(String id, String title) {
        return id.toLowerCase(Locale.ROOT) + " - " + sanitizeTitle(title) + ".md";
    }

    /** {@code .md} files directly inside {@code dir}, sorted by name; empty if the directory is missing. */
    public static List<Path> listRecords(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new StoreIoException("Failed to list " + dir, e);
        }
    }

    /**
     * Highest top-level number among ids with the given prefix, e.g. 12 for
     * {@code task-12.3 - x.md}; 0 when there is none.
     */
    public static int highestNumber(List<Path> files, String prefix) {
        Pattern pattern = Pattern.compile("^" + Pattern.quote(prefix.toLowerCase(Locale.ROOT)) + "-(\\d{1,9})(?!\\d)",
                Pattern.CASE_INSENSITIVE);
        int max = 0;
        for (Path file : files) {
            Matcher m = pattern.matcher(file.getFileName().toString());
            if (m.find()) {
                max = Math.max(max, Integer.parseInt(m.group(1)));
            }
        }
        return max;
    }

    /** Highest {@code k} among subtask ids {@code PARENT.k}; 0 when there is none. */
    public static int highestSubtaskNumber(List<String> ids, String parentId) {
        String prefix = parentId.toUpperCase(Locale.ROOT) + ".";
        int max = 0;
        for (String id : ids) {
            String upper = id.toUpperCase(Locale.ROOT);
            if (upper.startsWith(prefix)) {
                String rest = upper.substring(prefix.length());
                int dot = rest.indexOf('.');
                String number = dot >= 0 ? rest.substring(0, dot) : rest;
                if (number.matches("\\d{1,9}")) {
                    max = Math.max(max, Integer.parseInt(number));
                }
            }
        }
        return max;
    }

    static List<Path> listAll(List<Path> dirs) {
        var all = new ArrayList<Path>();
        for (Path dir : dirs) {
            all.addAll(listRecords(dir));
        }
        return all;
    }
}
