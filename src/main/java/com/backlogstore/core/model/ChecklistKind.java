package com.backlogstore.core.model;

/**
 * The two checklist sections a task body can carry.
 */
public enum ChecklistKind {
    ACCEPTANCE_CRITERIA,
    DEFINITION_OF_DONE
}
