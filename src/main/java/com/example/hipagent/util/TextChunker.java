package com.example.hipagent.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into windows of at most {@code chunkSize} characters, with roughly
 * {@code overlap} characters repeated between neighbours.
 *
 * A window is cut, in order of preference, after a paragraph break, after a sentence end,
 * or at whitespace, as long as the cut falls in the second half of the window. Otherwise
 * the window is cut hard at {@code chunkSize}. The last window is always kept, however short.
 */
public final class TextChunker {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextChunker() {
    }

    public record Slice(int start, String text) {
    }

    /**
     * Collapses runs of blank lines and strips the text, keeping the paragraph structure.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        return EXCESS_BLANK_LINES.matcher(unified).replaceAll("\n\n").strip();
    }

    public static List<Slice> split(String text, int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap must be in [0, chunkSize), got " + overlap + " for chunkSize " + chunkSize);
        }
        List<Slice> slices = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return slices;
        }

        int length = text.length();
        int start = 0;
        while (start < length) {
            while (start < length && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            if (start >= length) {
                break;
            }

            int hardEnd = Math.min(start + chunkSize, length);
            int end = hardEnd == length ? length : findBreak(text, start, hardEnd, chunkSize);
            slices.add(new Slice(start, text.substring(start, end).stripTrailing()));
            if (end >= length) {
                break;
            }

            int next = end - overlap;
            if (next <= start) {
                next = end;
            } else {
                // start the overlap on a word boundary when one is available
                int aligned = next;
                while (aligned < end && !Character.isWhitespace(text.charAt(aligned - 1))) {
                    aligned++;
                }
                if (aligned < end) {
                    next = aligned;
                }
            }
            start = next;
        }
        return slices;
    }

    private static int findBreak(String text, int start, int hardEnd, int chunkSize) {
        int floor = start + Math.max(1, chunkSize / 2);

        int paragraph = text.lastIndexOf("\n\n", hardEnd - 2);
        if (paragraph >= floor) {
            return paragraph;
        }

        for (int i = hardEnd - 2; i >= floor - 1; i--) {
            char c = text.charAt(i);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i + 1))) {
                return i + 1;
            }
        }

        for (int i = hardEnd; i >= floor; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return hardEnd;
    }
}
