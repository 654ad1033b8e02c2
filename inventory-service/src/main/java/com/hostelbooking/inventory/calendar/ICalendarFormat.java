package com.hostelbooking.inventory.calendar;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * RFC 5545 text plumbing: content-line unfolding and folding, TEXT escaping and DATE values.
 */
final class ICalendarFormat {

    static final String CRLF = "\r\n";
    static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;
    static final DateTimeFormatter UTC_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private static final int MAX_LINE_OCTETS = 75;

    private ICalendarFormat() {
        // Utility class
    }

    /**
     * Splits a document into logical content lines, joining continuation lines (leading space or tab).
     */
    static List<String> unfold(String document) {
        List<String> lines = new ArrayList<>();
        StringBuilder current = null;
        for (String physical : document.split("\r\n|\n|\r", -1)) {
            if (!physical.isEmpty() && (physical.charAt(0) == ' ' || physical.charAt(0) == '\t')) {
                if (current != null) {
                    current.append(physical, 1, physical.length());
                }
                continue;
            }
            if (current != null) {
                lines.add(current.toString());
            }
            current = new StringBuilder(physical);
        }
        if (current != null && current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Folds a content line at 75 octets without splitting a UTF-8 sequence.
     */
    static String fold(String line) {
        StringBuilder out = new StringBuilder();
        int octets = 0;
        int limit = MAX_LINE_OCTETS;
        for (int i = 0; i < line.length(); ) {
            int codePoint = line.codePointAt(i);
            int charCount = Character.charCount(codePoint);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (octets + size > limit) {
                out.append(CRLF).append(' ');
                octets = 0;
                limit = MAX_LINE_OCTETS - 1;
            }
            out.appendCodePoint(codePoint);
            octets += size;
            i += charCount;
        }
        return out.toString();
    }

    static String escapeText(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\")
                .replace(";", "\\;")
                .replace(",", "\\,")
                .replace("\r\n", "\\n")
                .replace("\n", "\\n");
    }

    static String unescapeText(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                switch (next) {
                    case 'n', 'N' -> out.append('\n');
                    case ',', ';', '\\' -> out.append(next);
                    default -> out.append('\\').append(next);
                }
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String formatDate(LocalDate date) {
        return date.format(DATE);
    }
}
