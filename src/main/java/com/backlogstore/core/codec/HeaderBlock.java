package com.backlogstore.core.codec;

import com.backlogstore.core.model.HeaderField;

import java.util.List;
import java.util.Optional;

/**
 * The header between the opening and closing {@code ---} lines, kept as raw
 * entries so unknown keys and formatting survive a rewrite.
 */
public final class HeaderBlock {

    static final String DELIMITER = "---";

    private final String opening;
    private final List<HeaderEntry> entries;
    private final String closing;

    HeaderBlock(String opening, List<HeaderEntry> entries, String closing) {
        this.opening = opening;
        this.entries = List.copyOf(entries);
        this.closing = closing;
    }

    public List<HeaderEntry> entries() {
        return entries;
    }

    /** The first entry spelled as any alias of {@code field}. */
    public Optional<HeaderEntry> entry(HeaderField field) {
        return entries.stream().filter(e -> field.matches(e.key())).findFirst();
    }

    public int indexOf(HeaderField field) {
        for (int i = 0; i < entries.size(); i++) {
            if (field.matches(entries.get(i).key())) {
                return i;
            }
        }
        return -1;
    }

    /** Header content without the delimiter lines; this is what gets decoded as YAML. */
    public String innerText() {
        var sb = new StringBuilder();
        for (HeaderEntry entry : entries) {
            sb.append(entry.raw());
        }
        return sb.toString();
    }

    boolean closingTerminated() {
        return Lines.isTerminated(closing);
    }

    HeaderBlock withEntries(List<HeaderEntry> newEntries) {
        return new HeaderBlock(opening, newEntries, closing);
    }

    /** Same block with a line break after the closing delimiter, so body text can follow it. */
    HeaderBlock withTerminatedClosing(String newline) {
        return closingTerminated() ? this : new HeaderBlock(opening, entries, closing + newline);
    }

    public String render() {
        return opening + innerText() + closing;
    }
}
