package com.convoviewer.viewer.search;

import com.convoviewer.viewer.model.MatchSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextMatcherTest {

    @Test
    void testFindAllIsCaseInsensitiveAndNonOverlapping() {
        List<MatchSpan> spans = TextMatcher.findAll("Aaaa aA", "aa");

        assertEquals(List.of(new MatchSpan(0, 2), new MatchSpan(2, 4), new MatchSpan(5, 7)), spans);
    }

    @Test
    void testNoMatches() {
        assertTrue(TextMatcher.findAll("hello", "world").isEmpty());
        assertTrue(TextMatcher.findAll(null, "x").isEmpty());
        assertEquals(0, TextMatcher.count("hello", ""));
        assertFalse(TextMatcher.contains("hi", "hello"));
    }

    @Test
    void testSnippetMarksCutEnds() {
        String text = "x".repeat(200) + " needle " + "y".repeat(200);
        MatchSpan first = TextMatcher.findAll(text, "needle").get(0);

        String snippet = TextMatcher.snippet(text, first);

        assertTrue(snippet.startsWith("..."));
        assertTrue(snippet.endsWith("..."));
        assertTrue(snippet.contains("needle"));
    }

    @Test
    void testSnippetCollapsesWhitespace() {
        String text = "find\n\n  the   needle\there";

        assertEquals("find the needle here", TextMatcher.snippet(text, TextMatcher.findAll(text, "needle").get(0)));
    }
}
