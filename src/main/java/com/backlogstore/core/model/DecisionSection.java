package com.backlogstore.core.model;

/**
 * Named body sections of a decision record.
 */
public enum DecisionSection {
    CONTEXT,
    DECISION,
    CONSEQUENCES,
    ALTERNATIVES
}
