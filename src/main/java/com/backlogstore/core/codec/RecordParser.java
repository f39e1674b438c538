package com.backlogstore.core.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw record text into a {@link MarkdownRecord}. Pure text scanning:
 * nothing here fails, whatever the input. Header values are decoded
 * separately by {@link HeaderYaml} so callers choose between lenient and
 * strict handling.
 */
public final class RecordParser {

    private static final Pattern PLAIN_KEY = Pattern.compile("^([^\\s#'\"\\[\\]{}?|>&*!%@`-][^#]*?)\\s*:(?:[ \\t].*)?$");
    private static final Pattern DOUBLE_QUOTED_KEY = Pattern.compile("^\"((?:[^\"\\\\]|\\\\.)*)\"\\s*:(?:[ \\t].*)?$");
    private static final Pattern SINGLE_QUOTED_KEY = Pattern.compile("^'((?:[^']|'')*)'\\s*:(?:[ \\t].*)?$");
    private static final Pattern SECTION_HEADING = Pattern.compile("^##[ \\t]+(\\S.*?)\\s*$");

    private RecordParser() {
    }

    public static MarkdownRecord parse(String text, Function<String, SectionKind> classifier) {
        String newline = Lines.detectNewline(text);
        List<String> lines = Lines.split(text);

        HeaderBlock header = null;
        int bodyStart = 0;
        if (!lines.isEmpty() && Lines.content(lines.get(0)).trim().equals(HeaderBlock.DELIMITER)) {
            int closingIndex = -1;
            for (int i = 1; i < lines.size(); i++) {
                if (Lines.content(lines.get(i)).trim().equals(HeaderBlock.DELIMITER)) {
                    closingIndex = i;
                    break;
                }
            }
            if (closingIndex > 0) {
                header = new HeaderBlock(lines.get(0),
                        groupEntries(lines.subList(1, closingIndex)),
                        lines.get(closingIndex));
                bodyStart = closingIndex + 1;
            }
        }

        List<BodySpan> spans = splitSpans(lines.subList(bodyStart, lines.size()), classifier);
        return new MarkdownRecord(header, spans, newline);
    }

    private static List<HeaderEntry> groupEntries(List<String> lines) {
        var entries = new ArrayList<HeaderEntry>();
        String key = null;
        var current = new StringBuilder();
        for (String line : lines) {
            String lineKey = topLevelKey(Lines.content(line));
            if (lineKey != null) {
                if (key != null || current.length() > 0) {
                    entries.add(new HeaderEntry(key, current.toString()));
                }
                key = lineKey;
                current = new StringBuilder();
            }
            current.append(line);
        }
        if (key != null || current.length() > 0) {
            entries.add(new HeaderEntry(key, current.toString()));
        }
        return entries;
    }

    /**
     * The key a non-indented {@code key: value} line starts, unquoted; {@code null}
     * for indented lines, comments, block list items and anything else that
     * continues the previous entry.
     */
    static String topLevelKey(String line) {
        if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
            return null;
        }
        Matcher m = DOUBLE_QUOTED_KEY.matcher(line);
        if (m.matches()) {
            return m.group(1);
        }
        m = SINGLE_QUOTED_KEY.matcher(line);
        if (m.matches()) {
            return m.group(1).replace("''", "'");
        }
        m = PLAIN_KEY.matcher(line);
        return m.matches() ? m.group(1) : null;
    }

    private static List<BodySpan> splitSpans(List<String> lines, Function<String, SectionKind> classifier) {
        var spans = new ArrayList<BodySpan>();
        SectionKind kind = SectionKind.PREAMBLE;
        String heading = null;
        var current = new StringBuilder();
        var fence = new FenceTracker();

        for (String line : lines) {
            String content = Lines.content(line);
            if (!fence.update(content)) {
                Matcher m = SECTION_HEADING.matcher(content);
                if (m.matches()) {
                    if (kind != SectionKind.PREAMBLE || current.length() > 0) {
                        spans.add(new BodySpan(kind, heading, current.toString()));
                    }
                    heading = m.group(1);
                    kind = classifier.apply(heading);
                    current = new StringBuilder();
                }
            }
            current.append(line);
        }
        if (kind != SectionKind.PREAMBLE || current.length() > 0) {
            spans.add(new BodySpan(kind, heading, current.toString()));
        }
        return spans;
    }

    /**
     * Tracks fenced code blocks line by line. {@link #update} returns true while
     * the line belongs to a fence (the fence delimiters included), so nothing
     * inside one is read as structure.
     */
    static final class FenceTracker {

        private String open;

        boolean update(String lineContent) {
            String trimmed = lineContent.stripLeading();
            if (open == null) {
                if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                    open = trimmed.substring(0, 3);
                    return true;
                }
                return false;
            }
            if (trimmed.startsWith(open)) {
                open = null;
            }
            return true;
        }
    }
}
