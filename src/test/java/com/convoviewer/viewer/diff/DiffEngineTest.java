package com.convoviewer.viewer.diff;

import com.convoviewer.viewer.model.DiffLine;
import com.convoviewer.viewer.model.DiffResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DiffEngineTest {

    private DiffEngine diffEngine;

    @BeforeEach
    void setUp() {
        diffEngine = new DiffEngine(4000, 2000);
    }

    @Test
    void testIdenticalTextIsAllContext() {
        String text = "line one\nline two\nline three\n";

        DiffResult result = diffEngine.diff(text, text);

        assertEquals(3, result.getLines().size());
        assertTrue(result.getLines().stream().allMatch(l -> l.getKind() == DiffLine.Kind.CONTEXT));
        assertFalse(result.hasChanges());
        assertFalse(result.isTruncated());
        assertFalse(result.isCoarse());
    }

    @Test
    void testEmptyToOneLineIsOneAddition() {
        DiffResult result = diffEngine.diff("", "x\n");

        assertEquals(1, result.getLines().size());
        DiffLine line = result.getLines().get(0);
        assertEquals(DiffLine.Kind.ADDED, line.getKind());
        assertEquals("x", line.getText());
        assertNull(line.getOldLineNo());
        assertEquals(1, line.getNewLineNo());
    }

    @Test
    void testOneLineToEmptyIsOneRemoval() {
        DiffResult result = diffEngine.diff("x\n", "");

        assertEquals(1, result.getLines().size());
        DiffLine line = result.getLines().get(0);
        assertEquals(DiffLine.Kind.REMOVED, line.getKind());
        assertEquals("x", line.getText());
        assertEquals(1, line.getOldLineNo());
        assertNull(line.getNewLineNo());
    }

    @Test
    void testChangedLineIsRemovalThenAddition() {
        DiffResult result = diffEngine.diff("a\nb\nc\n", "a\nB\nc\n");

        List<DiffLine> lines = result.getLines();
        assertEquals(4, lines.size());
        assertEquals(new DiffLine(DiffLine.Kind.CONTEXT, 1, 1, "a"), lines.get(0));
        assertEquals(new DiffLine(DiffLine.Kind.REMOVED, 2, null, "b"), lines.get(1));
        assertEquals(new DiffLine(DiffLine.Kind.ADDED, null, 2, "B"), lines.get(2));
        assertEquals(new DiffLine(DiffLine.Kind.CONTEXT, 3, 3, "c"), lines.get(3));
    }

    @Test
    void testInsertionInTheMiddleIsMinimal() {
        String before = "one\ntwo\nthree\nfour\nfive\n";
        String after = "one\ntwo\nthree and a half\nthree\nfour\nfive\n";

        DiffResult result = diffEngine.diff(before, after);

        List<DiffLine> changes = result.getLines().stream()
                .filter(l -> l.getKind() != DiffLine.Kind.CONTEXT)
                .collect(Collectors.toList());
        assertEquals(1, changes.size());
        assertEquals(DiffLine.Kind.ADDED, changes.get(0).getKind());
        assertEquals("three and a half", changes.get(0).getText());
        assertEquals(3, changes.get(0).getNewLineNo());
    }

    @Test
    void testInterleavedEditsKeepCommonLines() {
        String before = "a\nb\nc\nd\ne\n";
        String after = "a\nx\nc\ny\ne\n";

        DiffResult result = diffEngine.diff(before, after);

        long context = result.getLines().stream().filter(l -> l.getKind() == DiffLine.Kind.CONTEXT).count();
        long removed = result.getLines().stream().filter(l -> l.getKind() == DiffLine.Kind.REMOVED).count();
        long added = result.getLines().stream().filter(l -> l.getKind() == DiffLine.Kind.ADDED).count();
        assertEquals(3, context);
        assertEquals(2, removed);
        assertEquals(2, added);
    }

    @Test
    void testCrlfAndLfCompareEqual() {
        DiffResult result = diffEngine.diff("a\r\nb\r\n", "a\nb\n");

        assertFalse(result.hasChanges());
        assertEquals(2, result.getLines().size());
    }

    @Test
    void testLargeChangedRegionFallsBackToBlockDiff() {
        DiffEngine small = new DiffEngine(2, 2000);

        DiffResult result = small.diff("keep\na\nb\nc\n", "keep\nx\ny\nz\n");

        assertTrue(result.isCoarse());
        List<DiffLine.Kind> kinds = result.getLines().stream().map(DiffLine::getKind).collect(Collectors.toList());
        assertEquals(List.of(
                DiffLine.Kind.CONTEXT,
                DiffLine.Kind.REMOVED, DiffLine.Kind.REMOVED, DiffLine.Kind.REMOVED,
                DiffLine.Kind.ADDED, DiffLine.Kind.ADDED, DiffLine.Kind.ADDED), kinds);
    }

    @Test
    void testLongOutputIsTruncated() {
        DiffEngine small = new DiffEngine(4000, 3);

        DiffResult result = small.diff("1\n2\n3\n4\n5\n", "1\n2\n3\n4\n5\n");

        assertTrue(result.isTruncated());
        assertEquals(3, result.getLines().size());
    }

    @Test
    void testSplitLinesDropsOnlyTheTrailingNewline() {
        assertEquals(List.of(), DiffEngine.splitLines(""));
        assertEquals(List.of(), DiffEngine.splitLines(null));
        assertEquals(List.of("a", "b"), DiffEngine.splitLines("a\nb\n"));
        assertEquals(List.of("a", "", "b"), DiffEngine.splitLines("a\n\nb"));
    }
}
