package com.di.sqlpulse.util;

import java.nio.charset.StandardCharsets;

/**
 * Length limits for values written to durable storage.
 */
public final class TextLimits {

    private TextLimits() {
    }

    /**
     * Cuts {@code text} so its UTF-8 encoding fits in {@code maxBytes}, never splitting a
     * character (surrogate pairs are kept together).
     */
    public static String truncateUtf8(String text, int maxBytes) {
        if (text == null) {
            return null;
        }
        if (maxBytes <= 0) {
            return "";
        }
        // fast path: every char is at most 3 bytes
        if ((long) text.length() * 3 <= maxBytes) {
            return text;
        }
        int bytes = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = utf8Width(codePoint);
            if (bytes + width > maxBytes) {
                break;
            }
            bytes += width;
            i += Character.charCount(codePoint);
        }
        return i == text.length() ? text : text.substring(0, i);
    }

    public static int utf8Length(String text) {
        return text == null ? 0 : text.getBytes(StandardCharsets.UTF_8).length;
    }

    /** Cuts to at most {@code maxChars} characters. */
    public static String truncateChars(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }
}
