package com.convoviewer.viewer.search;

import com.convoviewer.viewer.model.MatchSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Case-insensitive, non-overlapping substring matching.
 */
public final class TextMatcher {

    public static final int SNIPPET_RADIUS = 80;

    private TextMatcher() {
    }

    public static List<MatchSpan> findAll(String text, String query) {
        List<MatchSpan> spans = new ArrayList<>();
        if (text == null || query == null || query.isEmpty()) {
            return spans;
        }
        int length = query.length();
        int i = 0;
        while (i + length <= text.length()) {
            if (text.regionMatches(true, i, query, 0, length)) {
                spans.add(new MatchSpan(i, i + length));
                i += length;
            } else {
                i++;
            }
        }
        return spans;
    }

    public static int count(String text, String query) {
        return findAll(text, query).size();
    }

    public static boolean contains(String text, String query) {
        if (text == null || query == null || query.isEmpty()) {
            return false;
        }
        int length = query.length();
        for (int i = 0; i + length <= text.length(); i++) {
            if (text.regionMatches(true, i, query, 0, length)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Text around the first match, with "..." where it was cut. Whitespace runs are collapsed.
     */
    public static String snippet(String text, MatchSpan first) {
        if (text == null) {
            return "";
        }
        int start = Math.max(0, first.getStart() - SNIPPET_RADIUS);
        int end = Math.min(text.length(), first.getEnd() + SNIPPET_RADIUS);
        String body = text.substring(start, end).replaceAll("\\s+", " ").strip();
        return (start > 0 ? "..." : "") + body + (end < text.length() ? "..." : "");
    }
}
