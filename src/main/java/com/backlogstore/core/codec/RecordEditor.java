package com.backlogstore.core.codec;

import com.backlogstore.core.model.HeaderField;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Record-level edits built on {@link HeaderEditor} and {@link SectionEditor}.
 * Each edit re-parses the rendered text so span kinds always match what a
 * fresh read of the file would see.
 */
final class RecordEditor {

    private RecordEditor() {
    }

    static MarkdownRecord setHeaderField(MarkdownRecord record, HeaderField field, Object value) {
        String nl = record.newline();
        HeaderBlock header = record.header()
                .orElseGet(() -> new HeaderBlock(HeaderBlock.DELIMITER + nl, List.of(), HeaderBlock.DELIMITER + nl));
        if (!record.spans().isEmpty()) {
            header = header.withTerminatedClosing(nl);
        }
        MarkdownRecord edited = record.withHeader(HeaderEditor.apply(header, field, value, nl));
        if (record.header().isEmpty() && !record.spans().isEmpty()) {
            // New header in front of an existing body: keep a blank line between them.
            List<BodySpan> spans = new ArrayList<>(edited.spans());
            BodySpan first = spans.get(0);
            if (!Lines.isBlank(Lines.split(first.raw()).get(0))) {
                spans.set(0, new BodySpan(first.kind(), first.heading(), nl + first.raw()));
            }
            edited = edited.withSpans(spans);
        }
        return edited;
    }

    /**
     * Replaces the content of the first section of {@code kind}, or inserts a
     * new section after the closest preceding section in {@code order}.
     */
    static MarkdownRecord setSection(MarkdownRecord record, SectionKind kind, String text,
                                     List<SectionKind> order, Function<String, SectionKind> classifier) {
        String nl = record.newline();
        List<BodySpan> spans = new ArrayList<>(record.spans());
        MarkdownRecord edited;

        int existing = indexOf(spans, kind);
        if (existing >= 0) {
            spans.set(existing, SectionEditor.replace(spans.get(existing), text, nl));
            edited = record.withSpans(spans);
        } else {
            edited = insertSection(record, spans, kind, text, order);
        }
        return RecordParser.parse(edited.render(), classifier);
    }

    private static MarkdownRecord insertSection(MarkdownRecord record, List<BodySpan> spans,
                                                SectionKind kind, String text, List<SectionKind> order) {
        String nl = record.newline();
        int rank = order.indexOf(kind);
        int after = -1;
        int before = -1;
        for (int i = 0; i < spans.size(); i++) {
            int other = order.indexOf(spans.get(i).kind());
            if (other < 0) {
                continue;
            }
            if (other < rank) {
                after = i;
            } else if (before < 0) {
                before = i;
            }
        }
        int at;
        if (after >= 0) {
            at = after + 1;
        } else if (before >= 0) {
            at = before;
        } else {
            at = spans.size();
        }

        String section = SectionEditor.newSection(kind, text, nl);
        if (at > 0) {
            BodySpan previous = spans.get(at - 1);
            List<String> lines = Lines.split(previous.raw());
            String last = lines.isEmpty() ? "" : lines.get(lines.size() - 1);
            String raw = previous.raw();
            if (!Lines.isTerminated(last)) {
                raw = raw + nl;
            }
            if (!Lines.isBlank(last)) {
                raw = raw + nl;
            }
            spans.set(at - 1, new BodySpan(previous.kind(), previous.heading(), raw));
        } else {
            section = nl + section;
        }
        if (at < spans.size()) {
            section = section + nl;
        }
        spans.add(at, new BodySpan(kind, kind.title(), section));

        MarkdownRecord edited = record.withSpans(spans);
        return record.header()
                .map(header -> edited.withHeader(header.withTerminatedClosing(nl)))
                .orElse(edited);
    }

    private static int indexOf(List<BodySpan> spans, SectionKind kind) {
        for (int i = 0; i < spans.size(); i++) {
            if (spans.get(i).kind() == kind) {
                return i;
            }
        }
        return -1;
    }
}
