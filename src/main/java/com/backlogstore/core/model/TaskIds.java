package com.backlogstore.core.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Ordering of task ids by prefix, then numerically by each dotted segment,
 * so {@code TASK-2} sorts before {@code TASK-10} and {@code TASK-5.2} after {@code TASK-5}.
 */
public final class TaskIds {

    public static final Comparator<String> NATURAL_ORDER = TaskIds::compare;

    private TaskIds() {
    }

    public static int compare(String a, String b) {
        String[] left = split(a);
        String[] right = split(b);
        int prefix = left[0].compareTo(right[0]);
        if (prefix != 0) {
            return prefix;
        }
        String[] leftParts = left[1].split("\\.");
        String[] rightParts = right[1].split("\\.");
        for (int i = 0; i < Math.min(leftParts.length, rightParts.length); i++) {
            int cmp = compareSegment(leftParts[i], rightParts[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(leftParts.length, rightParts.length);
    }

    private static int compareSegment(String a, String b) {
        boolean aNumeric = !a.isEmpty() && a.chars().allMatch(Character::isDigit);
        boolean bNumeric = !b.isEmpty() && b.chars().allMatch(Character::isDigit);
        if (aNumeric && bNumeric) {
            int byLength = Integer.compare(a.replaceFirst("^0+(?=.)", "").length(),
                    b.replaceFirst("^0+(?=.)", "").length());
            return byLength != 0 ? byLength : a.replaceFirst("^0+(?=.)", "").compareTo(b.replaceFirst("^0+(?=.)", ""));
        }
        return a.compareTo(b);
    }

    private static String[] split(String id) {
        String upper = id.toUpperCase(Locale.ROOT);
        int dash = upper.lastIndexOf('-');
        if (dash < 0) {
            return new String[]{upper, ""};
        }
        return new String[]{upper.substring(0, dash), upper.substring(dash + 1)};
    }
}
