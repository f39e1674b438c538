package com.backlogstore.core.codec;

import java.util.ArrayList;
import java.util.List;

/**
 * Line splitting that keeps each line's terminator, so joining the pieces
 * gives back the original text exactly.
 */
final class Lines {

    private Lines() {
    }

    static List<String> split(String text) {
        var lines = new ArrayList<String>();
        int start = 0;
        int length = text.length();
        for (int i = 0; i < length; i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < length) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /** The line without its {@code \n} or {@code \r\n} terminator. */
    static String content(String line) {
        if (line.endsWith("\r\n")) {
            return line.substring(0, line.length() - 2);
        }
        if (line.endsWith("\n")) {
            return line.substring(0, line.length() - 1);
        }
        return line;
    }

    static boolean isTerminated(String line) {
        return line.endsWith("\n");
    }

    static boolean isBlank(String line) {
        return content(line).isBlank();
    }

    /** {@code \r\n} when the first terminated line uses it, otherwise {@code \n}. */
    static String detectNewline(String text) {
        int idx = text.indexOf('\n');
        if (idx > 0 && text.charAt(idx - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }

    /** Rewrites every line break in {@code text} to {@code newline}. */
    static String withNewline(String text, String newline) {
        return text.replace("\r\n", "\n").replace("\n", newline);
    }

    static String join(List<String> lines) {
        return String.join("", lines);
    }
}
