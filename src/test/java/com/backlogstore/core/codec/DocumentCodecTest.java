package com.backlogstore.core.codec;

import com.backlogstore.core.error.MalformedRecordException;
import com.backlogstore.core.model.Decision;
import com.backlogstore.core.model.DecisionSection;
import com.backlogstore.core.model.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCodecTest {

    private static final Path DECISION_FILE = Path.of("backlog/decisions/decision-1 - Use-markdown.md");

    private static final String DECISION = """
            ---
            id: decision-1
            title: Use Markdown
            date: 2024-01-02
            status: accepted
            ---

            ## Context

            We need storage.

            ## Decision

            Use files.
            """;

    @Test
    @DisplayName("decodes a decision and its sections")
    void decodesDecision() {
        Decision decision = DocumentCodec.decodeDecision(DECISION, DECISION_FILE);

        assertEquals("decision-1", decision.id());
        assertEquals("Use Markdown", decision.title());
        assertEquals("2024-01-02", decision.date());
        assertEquals("accepted", decision.status());
        assertEquals("We need storage.", decision.context());
        assertEquals("Use files.", decision.decision());
        assertNull(decision.consequences());
        assertNull(decision.alternatives());
    }

    @Test
    @DisplayName("replacing one section leaves the others untouched")
    void replacesOneSection() {
        String updated = DocumentCodec.replaceDecisionSection(DECISION, DECISION_FILE,
                DecisionSection.CONTEXT, "Storage is slow.");

        assertEquals(DECISION.replace("We need storage.", "Storage is slow."), updated);
    }

    @Test
    @DisplayName("a missing section is appended in canonical position")
    void appendsMissingSection() {
        String updated = DocumentCodec.replaceDecisionSection(DECISION, DECISION_FILE,
                DecisionSection.CONSEQUENCES, "More disk.");

        assertEquals(DECISION + "\n## Consequences\n\nMore disk.\n", updated);
        assertEquals("More disk.", DocumentCodec.decodeDecision(updated, DECISION_FILE).consequences());
    }

    @Test
    @DisplayName("refuses to rewrite a decision whose header does not parse")
    void malformedDecision() {
        assertThrows(MalformedRecordException.class, () -> DocumentCodec.replaceDecisionSection(
                "---\ntitle: [oops\n---\n## Context\n\nx\n", DECISION_FILE, DecisionSection.CONTEXT, "y"));
    }

    @Test
    @DisplayName("decodes a document with tags and raw body")
    void decodesDocument() {
        Document doc = DocumentCodec.decodeDocument(
                "---\nid: doc-1\ntitle: Guide\ntype: guide\ntags: [setup]\n---\n\n# Guide\n\nText\n",
                Path.of("backlog/docs/doc-1 - Guide.md"));

        assertEquals("doc-1", doc.id());
        assertEquals("Guide", doc.title());
        assertEquals("guide", doc.type());
        assertEquals(List.of("setup"), doc.tags());
        assertEquals("# Guide\n\nText", doc.content());
    }

    @Test
    @DisplayName("a document without header takes its id from the file name")
    void documentWithoutHeader() {
        Document doc = DocumentCodec.decodeDocument("Plain notes\n", Path.of("doc-2 - Notes.md"));

        assertEquals("doc-2", doc.id());
        assertEquals("doc-2", doc.title());
        assertEquals("Plain notes", doc.content());
    }
}
