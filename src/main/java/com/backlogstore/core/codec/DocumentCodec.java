package com.backlogstore.core.codec;

import com.backlogstore.core.error.MalformedRecordException;
import com.backlogstore.core.model.Decision;
import com.backlogstore.core.model.DecisionSection;
import com.backlogstore.core.model.Document;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Codec for the sibling record types: documents (header plus free text) and
 * decisions (header plus Context, Decision, Consequences and Alternatives
 * sections). Same header and span model as tasks.
 */
public final class DocumentCodec {

    private static final Logger log = LoggerFactory.getLogger(DocumentCodec.class);

    private DocumentCodec() {
    }

    public static Document decodeDocument(String content, Path file) {
        MarkdownRecord record = RecordParser.parse(content, SectionKind::forDocumentHeading);
        Map<String, Object> values = lenientHeader(record, file);
        String id = idOrFileName(values, file);
        return new Document(
                id,
                titleOr(values, id),
                HeaderValues.string(values.get("type")),
                DateValues.normalize(HeaderValues.string(
                        HeaderValues.lookup(values, List.of("created_date", "created")))),
                DateValues.normalize(HeaderValues.string(
                        HeaderValues.lookup(values, List.of("updated_date", "updated")))),
                HeaderValues.list(values.get("tags")),
                record.body().strip(),
                file);
    }

    public static Decision decodeDecision(String content, Path file) {
        MarkdownRecord record = RecordParser.parse(content, SectionKind::forDecisionHeading);
        Map<String, Object> values = lenientHeader(record, file);
        String id = idOrFileName(values, file);
        return new Decision(
                id,
                titleOr(values, id),
                DateValues.normalize(HeaderValues.string(values.get("date"))),
                HeaderValues.string(values.get("status")),
                section(record, SectionKind.CONTEXT),
                section(record, SectionKind.DECISION),
                section(record, SectionKind.CONSEQUENCES),
                section(record, SectionKind.ALTERNATIVES),
                file);
    }

    /**
     * Replaces one decision section, creating it in canonical position when
     * missing. The other sections are left byte-for-byte.
     *
     * @throws MalformedRecordException when the header is not valid YAML
     */
    public static String replaceDecisionSection(String content, Path file, DecisionSection section, String text) {
        MarkdownRecord record = RecordParser.parse(content, SectionKind::forDecisionHeading);
        if (record.header().isPresent()) {
            try {
                HeaderYaml.decode(record.header().get().innerText());
            } catch (JsonProcessingException e) {
                throw new MalformedRecordException(file,
                        "Header of " + file + " is not valid YAML: " + e.getOriginalMessage(), e);
            }
        }
        return RecordEditor.setSection(record, sectionKind(section), text,
                SectionKind.DECISION_ORDER, SectionKind::forDecisionHeading).render();
    }

    static SectionKind sectionKind(DecisionSection section) {
        return switch (section) {
            case CONTEXT -> SectionKind.CONTEXT;
            case DECISION -> SectionKind.DECISION;
            case CONSEQUENCES -> SectionKind.CONSEQUENCES;
            case ALTERNATIVES -> SectionKind.ALTERNATIVES;
        };
    }

    private static Map<String, Object> lenientHeader(MarkdownRecord record, Path file) {
        if (record.header().isEmpty()) {
            return Map.of();
        }
        try {
            return HeaderYaml.decode(record.header().get().innerText());
        } catch (JsonProcessingException e) {
            log.warn("Unparseable header in {}: {}", file, e.getOriginalMessage());
            return Map.of();
        }
    }

    private static String idOrFileName(Map<String, Object> values, Path file) {
        String id = HeaderValues.string(values.get("id"));
        return id != null ? id.toLowerCase(Locale.ROOT) : TaskCodec.idFromFileName(file).toLowerCase(Locale.ROOT);
    }

    private static String titleOr(Map<String, Object> values, String fallback) {
        String title = HeaderValues.string(values.get("title"));
        return title != null ? title : fallback;
    }

    private static String section(MarkdownRecord record, SectionKind kind) {
        return record.span(kind).flatMap(SectionEditor::text).orElse(null);
    }
}
