package com.backlogstore.core.model;

/**
 * Free-text body sections of a task that can be replaced by an update.
 */
public enum BodyField {
    DESCRIPTION,
    IMPLEMENTATION_PLAN,
    IMPLEMENTATION_NOTES,
    FINAL_SUMMARY
}
