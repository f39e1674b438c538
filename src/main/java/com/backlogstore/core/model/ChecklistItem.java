package com.backlogstore.core.model;

/**
 * One line of an acceptance-criteria or definition-of-done list.
 *
 * @param id      stable number written as {@code #N}; never renumbered
 * @param text    item text after the id
 * @param checked whether the checkbox is ticked
 */
public record ChecklistItem(int id, String text, boolean checked) {

    public ChecklistItem toggled() {
        return new ChecklistItem(id, text, !checked);
    }
}
