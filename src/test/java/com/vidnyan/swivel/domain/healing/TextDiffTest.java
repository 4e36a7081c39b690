package com.vidnyan.swivel.domain.healing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextDiffTest {

    @Test
    void unified_ShouldBeEmptyForIdenticalText() {
        assertEquals("", TextDiff.unified("a\nb\n", "a\nb\n"));
    }

    @Test
    void unified_ShouldReportReplacedLineWithContext() {
        String diff = TextDiff.unified("a\nb\nc", "a\nx\nc", "iteration-0", "iteration-1");

        assertTrue(diff.startsWith("--- iteration-0\n+++ iteration-1\n"));
        assertTrue(diff.contains("@@ -1,3 +1,3 @@\n"));
        assertTrue(diff.contains("\n-b\n"));
        assertTrue(diff.contains("\n+x\n"));
        assertTrue(diff.contains(" a\n"));
        assertTrue(diff.contains(" c\n"));
    }

    @Test
    void unified_ShouldSplitDistantChangesIntoHunks() {
        StringBuilder before = new StringBuilder();
        for (int i = 1; i <= 20; i++) {
            before.append("line").append(i).append('\n');
        }
        String after = before.toString().replace("line2\n", "").replace("line18\n", "line18 changed\n");

        String diff = TextDiff.unified(before.toString(), after);

        assertEquals(2, diff.split("@@ -", -1).length - 1);
        assertTrue(diff.contains("-line2\n"));
        assertTrue(diff.contains("+line18 changed\n"));
    }

    private static String numberedLines(int count) {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            text.append("line").append(i).append('\n');
        }
        return text.toString();
    }

    @Test
    void unified_ShouldDiffOnlyChangedRegionOfLargeFile() {
        String before = numberedLines(20_000);
        String after = before.replace("line10000\n", "line10000\ninserted\n");

        String diff = TextDiff.unified(before, after);

        assertEquals(1, diff.split("@@ -", -1).length - 1);
        assertTrue(diff.contains("@@ -9999,4 +9999,5 @@\n"), diff);
        assertTrue(diff.contains("\n+inserted\n"));
    }

    @Test
    void unified_ShouldFallBackToReplacementWhenChangesSpanLargeFile() {
        String before = numberedLines(20_000);
        String after = before.replace("line1\n", "first\n").replace("line20000\n", "last\n");

        String diff = TextDiff.unified(before, after);

        assertTrue(diff.startsWith("--- before\n+++ after\n"));
        assertTrue(diff.contains("\n-line1\n"));
        assertTrue(diff.contains("\n+first\n"));
        assertTrue(diff.contains("\n+last\n"));
        assertTrue(diff.contains("\n-line20000\n"));
    }
}
