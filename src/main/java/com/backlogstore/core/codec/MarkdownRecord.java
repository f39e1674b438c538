package com.backlogstore.core.codec;

import java.util.List;
import java.util.Optional;

/**
 * A record file split into an optional header and ordered body spans.
 * {@link #render()} reproduces the parsed text exactly; edits swap single
 * entries or spans and leave everything else untouched.
 */
public final class MarkdownRecord {

    private final HeaderBlock header;
    private final List<BodySpan> spans;
    private final String newline;

    MarkdownRecord(HeaderBlock header, List<BodySpan> spans, String newline) {
        this.header = header;
        this.spans = List.copyOf(spans);
        this.newline = newline;
    }

    public Optional<HeaderBlock> header() {
        return Optional.ofNullable(header);
    }

    public List<BodySpan> spans() {
        return spans;
    }

    public Optional<BodySpan> span(SectionKind kind) {
        return spans.stream().filter(s -> s.kind() == kind).findFirst();
    }

    /** Line separator new text is written with: the file's own, {@code \n} by default. */
    public String newline() {
        return newline;
    }

    public String body() {
        var sb = new StringBuilder();
        for (BodySpan span : spans) {
            sb.append(span.raw());
        }
        return sb.toString();
    }

    MarkdownRecord withHeader(HeaderBlock newHeader) {
        return new MarkdownRecord(newHeader, spans, newline);
    }

    MarkdownRecord withSpans(List<BodySpan> newSpans) {
        return new MarkdownRecord(header, newSpans, newline);
    }

    public String render() {
        return (header == null ? "" : header.render()) + body();
    }
}
