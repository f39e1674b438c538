package com.backlogstore.core.codec;

import com.backlogstore.core.model.ChecklistItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and rewrites body sections one span at a time.
 */
final class SectionEditor {

    static final Pattern CHECKLIST_LINE =
            Pattern.compile("^(\\s*-\\s*\\[)([ xX])(]\\s*)(?:#(\\d{1,9})\\s+)?(.+?)\\s*$");

    private SectionEditor() {
    }

    /**
     * Semantic text of a section: the text between its markers when they are
     * present, otherwise every non-comment line after the heading.
     */
    static Optional<String> text(BodySpan span) {
        List<String> lines = Lines.split(span.raw());
        int[] markers = findMarkers(span.kind(), lines);
        var sb = new StringBuilder();
        if (markers != null) {
            for (int i = markers[0] + 1; i < markers[1]; i++) {
                sb.append(Lines.content(lines.get(i))).append('\n');
            }
        } else {
            for (int i = 1; i < lines.size(); i++) {
                String content = Lines.content(lines.get(i));
                if (!content.trim().startsWith("<!--")) {
                    sb.append(content).append('\n');
                }
            }
        }
        String value = sb.toString().strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Checklist items of a section. Lines without {@code #N} get their 1-based
     * position as id.
     */
    static List<ChecklistItem> checklist(BodySpan span) {
        var items = new ArrayList<ChecklistItem>();
        var fence = new RecordParser.FenceTracker();
        List<String> lines = Lines.split(span.raw());
        for (int i = 1; i < lines.size(); i++) {
            String content = Lines.content(lines.get(i));
            if (fence.update(content)) {
                continue;
            }
            Matcher m = CHECKLIST_LINE.matcher(content);
            if (m.matches()) {
                int id = m.group(4) != null ? Integer.parseInt(m.group(4)) : items.size() + 1;
                items.add(new ChecklistItem(id, m.group(5).trim(), !m.group(2).equals(" ")));
            }
        }
        return items;
    }

    /**
     * Flips the checkbox of every line in the span whose id equals {@code itemId}.
     * Everything else in the line is left as it was.
     *
     * @return the rewritten span and how many lines were toggled
     */
    static ToggleResult toggle(BodySpan span, int itemId) {
        var fence = new RecordParser.FenceTracker();
        List<String> lines = new ArrayList<>(Lines.split(span.raw()));
        int position = 0;
        int toggled = 0;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            String content = Lines.content(line);
            if (fence.update(content)) {
                continue;
            }
            Matcher m = CHECKLIST_LINE.matcher(content);
            if (!m.matches()) {
                continue;
            }
            position++;
            int id = m.group(4) != null ? Integer.parseInt(m.group(4)) : position;
            if (id != itemId) {
                continue;
            }
            char flipped = m.group(2).equals(" ") ? 'x' : ' ';
            int at = m.start(2);
            lines.set(i, line.substring(0, at) + flipped + line.substring(at + 1));
            toggled++;
        }
        return new ToggleResult(new BodySpan(span.kind(), span.heading(), Lines.join(lines)), toggled);
    }

    record ToggleResult(BodySpan span, int toggled) {
    }

    /**
     * Replaces the content of a section. With markers the text between them
     * is swapped; without, the section body is rewritten and gets markers if
     * its kind has them. Blank lines closing the span are kept.
     */
    static BodySpan replace(BodySpan span, String text, String newline) {
        List<String> lines = Lines.split(span.raw());
        String rendered = renderContent(text, newline);
        int[] markers = findMarkers(span.kind(), lines);
        if (markers != null) {
            var sb = new StringBuilder();
            for (int i = 0; i <= markers[0]; i++) {
                sb.append(lines.get(i));
            }
            sb.append(rendered);
            for (int i = markers[1]; i < lines.size(); i++) {
                sb.append(lines.get(i));
            }
            return new BodySpan(span.kind(), span.heading(), sb.toString());
        }

        String heading = lines.get(0);
        if (!Lines.isTerminated(heading)) {
            heading = heading + newline;
        }
        int trailingStart = lines.size();
        while (trailingStart > 1 && Lines.isBlank(lines.get(trailingStart - 1))) {
            trailingStart--;
        }
        var trailing = new StringBuilder();
        for (int i = trailingStart; i < lines.size(); i++) {
            trailing.append(lines.get(i));
        }
        String raw = heading + sectionBody(span.kind(), rendered, newline) + trailing;
        return new BodySpan(span.kind(), span.heading(), raw);
    }

    /** A complete new section, heading included. */
    static String newSection(SectionKind kind, String text, String newline) {
        return "## " + kind.title() + newline + sectionBody(kind, renderContent(text, newline), newline);
    }

    static String renderChecklist(List<ChecklistItem> items, String newline) {
        var sb = new StringBuilder();
        for (ChecklistItem item : items) {
            sb.append("- [").append(item.checked() ? 'x' : ' ').append("] #")
                    .append(item.id()).append(' ').append(item.text().strip()).append(newline);
        }
        return sb.toString();
    }

    private static String sectionBody(SectionKind kind, String rendered, String newline) {
        var sb = new StringBuilder();
        if (kind.blankAfterHeading()) {
            sb.append(newline);
        }
        if (kind.hasMarkers()) {
            sb.append(kind.beginMarker()).append(newline)
                    .append(rendered)
                    .append(kind.endMarker()).append(newline);
        } else {
            sb.append(rendered);
        }
        return sb.toString();
    }

    /** Normalizes {@code text} to whole lines ending in {@code newline}; empty stays empty. */
    private static String renderContent(String text, String newline) {
        if (text == null) {
            return "";
        }
        String trimmed = text.replace("\r\n", "\n").strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return Lines.withNewline(trimmed, newline) + newline;
    }

    /** Indexes of the begin and end marker lines, or {@code null} when the pair is absent. */
    private static int[] findMarkers(SectionKind kind, List<String> lines) {
        if (!kind.hasMarkers()) {
            return null;
        }
        var fence = new RecordParser.FenceTracker();
        int begin = -1;
        for (int i = 1; i < lines.size(); i++) {
            String content = Lines.content(lines.get(i));
            if (fence.update(content)) {
                continue;
            }
            String trimmed = content.trim();
            if (begin < 0 && trimmed.equals(kind.beginMarker())) {
                begin = i;
            } else if (begin >= 0 && trimmed.equals(kind.endMarker())) {
                return new int[]{begin, i};
            }
        }
        return null;
    }
}
