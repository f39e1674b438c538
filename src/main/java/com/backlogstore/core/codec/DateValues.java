package com.backlogstore.core.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date strings as they appear in record headers. Everything is normalized to
 * {@code YYYY-MM-DD} or {@code YYYY-MM-DD HH:MM}.
 */
public final class DateValues {

    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_TIME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})[ T](\\d{2}:\\d{2}).*$");
    private static final Pattern LEGACY_SHORT = Pattern.compile("^(\\d{2})[-/.](\\d{2})[-/.](\\d{2})$");

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private DateValues() {
    }

    /**
     * Normalizes a header date. Legacy {@code DD-MM-YY}, {@code DD/MM/YY} and
     * {@code DD.MM.YY} become {@code 20YY-MM-DD}; unrecognized values are
     * returned trimmed.
     */
    public static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (DATE.matcher(trimmed).matches()) {
            return trimmed;
        }
        Matcher dateTime = DATE_TIME.matcher(trimmed);
        if (dateTime.matches()) {
            return dateTime.group(1) + " " + dateTime.group(2);
        }
        Matcher legacy = LEGACY_SHORT.matcher(trimmed);
        if (legacy.matches()) {
            return "20" + legacy.group(3) + "-" + legacy.group(2) + "-" + legacy.group(1);
        }
        return trimmed;
    }

    public static String format(LocalDateTime time, boolean withTime) {
        return (withTime ? MINUTE : DAY).format(time);
    }
}
