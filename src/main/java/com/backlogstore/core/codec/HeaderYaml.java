package com.backlogstore.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes header text with Jackson YAML and renders single header lines in
 * the inline style the store writes.
 */
public final class HeaderYaml {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    /** {@code key: @handle} or {@code - @handle}: YAML reserves {@code @}, so quote it before decoding. */
    private static final Pattern BARE_AT_SCALAR =
            Pattern.compile("^(\\s*(?:[A-Za-z_][\\w-]*\\s*:|-)\\s+)(@\\S.*?)\\s*$");
    private static final Pattern INLINE_LIST =
            Pattern.compile("^(\\s*[A-Za-z_][\\w-]*\\s*:\\s*)\\[(.*)]\\s*$");
    private static final Pattern NUMBER_LIKE =
            Pattern.compile("^[-+]?(\\d[\\d_]*)?(\\.\\d*)?([eE][-+]?\\d+)?$|^0x[0-9a-fA-F]+$|^\\.(inf|nan)$",
                    Pattern.CASE_INSENSITIVE);
    private static final List<String> RESERVED_WORDS = List.of(
            "true", "false", "yes", "no", "on", "off", "y", "n", "null", "~");

    private HeaderYaml() {
    }

    /**
     * Decodes header content into an ordered key/value map.
     *
     * @throws JsonProcessingException when the content is not a YAML mapping
     */
    public static Map<String, Object> decode(String innerText) throws JsonProcessingException {
        if (innerText.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> values = YAML.readValue(quoteBareHandles(innerText),
                new TypeReference<LinkedHashMap<String, Object>>() {});
        return values == null ? new LinkedHashMap<>() : values;
    }

    static String quoteBareHandles(String innerText) {
        var sb = new StringBuilder();
        for (String line : Lines.split(innerText)) {
            String content = Lines.content(line);
            String terminator = line.substring(content.length());
            Matcher scalar = BARE_AT_SCALAR.matcher(content);
            Matcher list = INLINE_LIST.matcher(content);
            if (scalar.matches()) {
                content = scalar.group(1) + singleQuoted(scalar.group(2));
            } else if (list.matches() && list.group(2).contains("@")) {
                var items = new ArrayList<String>();
                for (String item : list.group(2).split(",")) {
                    String trimmed = item.trim();
                    items.add(trimmed.startsWith("@") ? singleQuoted(trimmed) : trimmed);
                }
                content = list.group(1) + "[" + String.join(", ", items) + "]";
            }
            sb.append(content).append(terminator);
        }
        return sb.toString();
    }

    /** {@code key: value} with the value quoted only when YAML needs it. */
    public static String scalarLine(String key, String value, String newline) {
        return key + ": " + scalar(value, false) + newline;
    }

    /** {@code key: [a, b]}; an empty list renders as {@code []}. */
    public static String listLine(String key, List<String> values, String newline) {
        var items = new ArrayList<String>();
        for (String value : values) {
            items.add(scalar(value, true));
        }
        return key + ": [" + String.join(", ", items) + "]" + newline;
    }

    public static String numberLine(String key, double value, String newline) {
        return key + ": " + formatNumber(value) + newline;
    }

    static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static String scalar(String value, boolean inFlowList) {
        return needsQuotes(value, inFlowList) ? singleQuoted(value) : value;
    }

    static boolean needsQuotes(String value, boolean inFlowList) {
        if (value.isEmpty() || !value.equals(value.strip())) {
            return true;
        }
        if ("-?:,[]{}#&*!|>'\"%@`".indexOf(value.charAt(0)) >= 0) {
            return true;
        }
        if (value.contains(": ") || value.contains(" #") || value.endsWith(":")
                || value.contains("\n") || value.contains("\t")) {
            return true;
        }
        if (inFlowList && (value.contains(",") || value.contains(":") || value.contains("[") || value.contains("]")
                || value.contains("{") || value.contains("}"))) {
            return true;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return RESERVED_WORDS.contains(lower) || NUMBER_LIKE.matcher(value).matches();
    }

    static String singleQuoted(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
