package com.legalgraph.util;

import org.springframework.stereotype.Component;

/**
 * Cuts a bounded, word-aligned snippet of text around a match.
 */
@Component
public class ContextWindow {

    /**
     * Snippet of at most {@code width} characters centred on
     * {@code [start, end)}. Partial words at either edge are dropped and
     * whitespace runs collapse to single spaces.
     */
    public String around(String text, int start, int end, int width) {
        if (text == null || text.isEmpty() || width <= 0) {
            return "";
        }
        int from = Math.max(0, Math.min(start, text.length()));
        int to = Math.max(from, Math.min(end, text.length()));

        if (to - from >= width) {
            return truncate(collapse(text.substring(from, to)), width);
        }

        int slack = width - (to - from);
        int before = slack / 2;
        int after = slack - before;

        // give unused room on one side to the other
        if (from - before < 0) {
            after += before - from;
            before = from;
        }
        if (to + after > text.length()) {
            int unused = to + after - text.length();
            after = text.length() - to;
            before = Math.min(from, before + unused);
        }

        int windowStart = from - before;
        int windowEnd = to + after;

        if (windowStart > 0 && !Character.isWhitespace(text.charAt(windowStart - 1))) {
            while (windowStart < from && !Character.isWhitespace(text.charAt(windowStart))) {
                windowStart++;
            }
        }
        if (windowEnd < text.length() && !Character.isWhitespace(text.charAt(windowEnd))) {
            while (windowEnd > to && !Character.isWhitespace(text.charAt(windowEnd - 1))) {
                windowEnd--;
            }
        }

        return collapse(text.substring(windowStart, windowEnd));
    }

    /**
     * Collapse whitespace runs and trim.
     */
    public String collapse(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }

    /**
     * Truncate text to maximum length, backing off to the last word boundary
     * when one exists.
     */
    public String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        String cut = text.substring(0, maxLength);
        int lastSpace = cut.lastIndexOf(' ');
        return lastSpace > 0 ? cut.substring(0, lastSpace) : cut;
    }
}
