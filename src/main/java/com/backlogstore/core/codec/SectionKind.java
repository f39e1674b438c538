package com.backlogstore.core.codec;

import java.util.List;
import java.util.Locale;

/**
 * Named body sections the codec understands. Anything else is kept as an
 * opaque span.
 */
public enum SectionKind {
    PREAMBLE(null, null, false),
    DESCRIPTION("Description", "SECTION:DESCRIPTION", true),
    ACCEPTANCE_CRITERIA("Acceptance Criteria", "AC", false),
    DEFINITION_OF_DONE("Definition of Done", "DOD", false),
    IMPLEMENTATION_PLAN("Implementation Plan", "SECTION:PLAN", true),
    IMPLEMENTATION_NOTES("Implementation Notes", "SECTION:NOTES", true),
    FINAL_SUMMARY("Final Summary", "SECTION:FINAL_SUMMARY", true),
    CONTEXT("Context", null, true),
    DECISION("Decision", null, true),
    CONSEQUENCES("Consequences", null, true),
    ALTERNATIVES("Alternatives", null, true),
    OTHER(null, null, false);

    /** Task sections in the order new ones are inserted. */
    public static final List<SectionKind> TASK_ORDER = List.of(
            DESCRIPTION, ACCEPTANCE_CRITERIA, DEFINITION_OF_DONE,
            IMPLEMENTATION_PLAN, IMPLEMENTATION_NOTES, FINAL_SUMMARY);

    public static final List<SectionKind> DECISION_ORDER = List.of(
            CONTEXT, DECISION, CONSEQUENCES, ALTERNATIVES);

    private final String title;
    private final String markerName;
    private final boolean blankAfterHeading;

    SectionKind(String title, String markerName, boolean blankAfterHeading) {
        this.title = title;
        this.markerName = markerName;
        this.blankAfterHeading = blankAfterHeading;
    }

    /** Heading text used when the section has to be created. */
    public String title() {
        return title;
    }

    public boolean hasMarkers() {
        return markerName != null;
    }

    public String beginMarker() {
        return "<!-- " + markerName + ":BEGIN -->";
    }

    public String endMarker() {
        return "<!-- " + markerName + ":END -->";
    }

    boolean blankAfterHeading() {
        return blankAfterHeading;
    }

    /** Classifies a {@code ## } heading of a task body. */
    public static SectionKind forTaskHeading(String heading) {
        String name = heading.toLowerCase(Locale.ROOT);
        if (name.contains("description")) {
            return DESCRIPTION;
        }
        if (name.contains("acceptance criteria")) {
            return ACCEPTANCE_CRITERIA;
        }
        if (name.contains("definition of done")) {
            return DEFINITION_OF_DONE;
        }
        if (name.contains("implementation notes") || name.equals("notes")) {
            return IMPLEMENTATION_NOTES;
        }
        if (name.contains("plan")) {
            return IMPLEMENTATION_PLAN;
        }
        if (name.contains("summary")) {
            return FINAL_SUMMARY;
        }
        return OTHER;
    }

    /** Classifies a {@code ## } heading of a decision body. */
    public static SectionKind forDecisionHeading(String heading) {
        return switch (heading.trim().toLowerCase(Locale.ROOT)) {
            case "context" -> CONTEXT;
            case "decision" -> DECISION;
            case "consequences" -> CONSEQUENCES;
            case "alternatives" -> ALTERNATIVES;
            default -> OTHER;
        };
    }

    /** Documents have no structured sections. */
    public static SectionKind forDocumentHeading(String heading) {
        return OTHER;
    }
}
