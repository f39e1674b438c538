package com.backlogstore.core.store;

import com.backlogstore.core.model.TaskIds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ordinal arithmetic for moving a task to a position within a status column.
 *
 * <p>Cards with an ordinal sort first, ascending; cards without one sort
 * last by id. Dropping a card assigns it an ordinal between its new
 * neighbours, and also numbers any ordinal-less cards above it so they keep
 * their visual position after a reload.
 */
public final class OrdinalCalculator {

    static final double DEFAULT_STEP = 1000;

    public static final Comparator<Card> BY_ORDINAL = OrdinalCalculator::compare;

    private OrdinalCalculator() {
    }

    public record Card(String taskId, Double ordinal) {

        boolean hasOrdinal() {
            return ordinal != null;
        }
    }

    public record OrdinalUpdate(String taskId, double ordinal) {
    }

    public static int compare(Card a, Card b) {
        if (a.hasOrdinal() && !b.hasOrdinal()) {
            return -1;
        }
        if (!a.hasOrdinal() && b.hasOrdinal()) {
            return 1;
        }
        if (a.hasOrdinal()) {
            return Double.compare(a.ordinal(), b.ordinal());
        }
        return TaskIds.compare(a.taskId(), b.taskId());
    }

    /**
     * Ordinal updates for dropping {@code dropped} at {@code dropIndex} of
     * {@code column} (cards in visual order). The dropped card may already be
     * in the column when it is reordered within it.
     */
    public static List<OrdinalUpdate> calculateForDrop(List<Card> column, Card dropped, int dropIndex) {
        int originalIndex = -1;
        var order = new ArrayList<Card>();
        for (int i = 0; i < column.size(); i++) {
            Card card = column.get(i);
            if (card.taskId().equals(dropped.taskId())) {
                originalIndex = i;
            } else {
                order.add(card);
            }
        }
        int index = dropIndex;
        if (originalIndex != -1 && originalIndex < dropIndex) {
            index--;
        }
        index = Math.max(0, Math.min(index, order.size()));
        order.add(index, dropped);

        var needing = new ArrayList<Integer>();
        for (int i = 0; i <= index; i++) {
            Card card = order.get(i);
            if (!card.hasOrdinal() || card.taskId().equals(dropped.taskId())) {
                needing.add(i);
            }
        }

        int first = needing.get(0);
        double base = 0;
        if (first > 0 && order.get(first - 1).hasOrdinal()) {
            base = order.get(first - 1).ordinal();
        }
        Double ceiling = null;
        for (int i = index + 1; i < order.size(); i++) {
            if (order.get(i).hasOrdinal()) {
                ceiling = order.get(i).ordinal();
                break;
            }
        }
        double step = DEFAULT_STEP;
        if (ceiling != null) {
            step = Math.min(DEFAULT_STEP, (ceiling - base) / (needing.size() + 1));
        }

        var updates = new ArrayList<OrdinalUpdate>();
        for (int i = 0; i < needing.size(); i++) {
            updates.add(new OrdinalUpdate(order.get(needing.get(i)).taskId(), base + step * (i + 1)));
        }
        return updates;
    }
}
