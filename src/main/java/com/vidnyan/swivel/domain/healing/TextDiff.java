package com.vidnyan.swivel.domain.healing;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based unified diff between two snapshots, used as provenance for healing iterations.
 * Common leading and trailing lines are matched directly; the region between them is diffed by
 * LCS, or reported as a whole replacement when the LCS table would exceed {@value #MAX_TABLE_CELLS}
 * cells.
 */
public final class TextDiff {

    private static final int CONTEXT = 2;
    static final long MAX_TABLE_CELLS = 4_000_000;

    private TextDiff() {
    }

    public static String unified(String before, String after) {
        return unified(before, after, "before", "after");
    }

    public static String unified(String before, String after, String fromLabel, String toLabel) {
        List<String> a = lines(before);
        List<String> b = lines(after);
        List<Line> script = script(a, b);
        if (script.stream().allMatch(line -> line.op == ' ')) {
            return "";
        }

        StringBuilder out = new StringBuilder();
        out.append("--- ").append(fromLabel).append('\n');
        out.append("+++ ").append(toLabel).append('\n');

        int i = 0;
        while (i < script.size()) {
            if (script.get(i).op == ' ') {
                i++;
                continue;
            }
            int start = Math.max(0, i - CONTEXT);
            int end = i;
            // extend the hunk while changes are within 2 * CONTEXT of each other
            int lastChange = i;
            while (end < script.size() && end - lastChange <= 2 * CONTEXT) {
                if (script.get(end).op != ' ') {
                    lastChange = end;
                }
                end++;
            }
            end = Math.min(script.size(), lastChange + CONTEXT + 1);
            appendHunk(out, script, start, end);
            i = end;
        }
        return out.toString();
    }

    private static void appendHunk(StringBuilder out, List<Line> script, int start, int end) {
        Line first = script.get(start);
        int fromCount = 0;
        int toCount = 0;
        for (int k = start; k < end; k++) {
            char op = script.get(k).op;
            if (op != '+') {
                fromCount++;
            }
            if (op != '-') {
                toCount++;
            }
        }
        out.append("@@ -").append(first.fromLine).append(',').append(fromCount)
                .append(" +").append(first.toLine).append(',').append(toCount).append(" @@\n");
        for (int k = start; k < end; k++) {
            Line line = script.get(k);
            out.append(line.op).append(line.text).append('\n');
        }
    }

    private static List<Line> script(List<String> a, List<String> b) {
        int prefix = 0;
        while (prefix < a.size() && prefix < b.size() && a.get(prefix).equals(b.get(prefix))) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < a.size() - prefix && suffix < b.size() - prefix
                && a.get(a.size() - 1 - suffix).equals(b.get(b.size() - 1 - suffix))) {
            suffix++;
        }

        List<Line> script = new ArrayList<>();
        for (int k = 0; k < prefix; k++) {
            script.add(new Line(' ', a.get(k), k + 1, k + 1));
        }
        List<String> middleA = a.subList(prefix, a.size() - suffix);
        List<String> middleB = b.subList(prefix, b.size() - suffix);
        if ((long) middleA.size() * middleB.size() <= MAX_TABLE_CELLS) {
            middle(script, middleA, middleB, prefix);
        } else {
            replaced(script, middleA, middleB, prefix);
        }
        for (int k = suffix; k > 0; k--) {
            script.add(new Line(' ', a.get(a.size() - k), a.size() - k + 1, b.size() - k + 1));
        }
        return script;
    }

    /**
     * LCS over the changed region; {@code offset} lines precede it in both snapshots.
     */
    private static void middle(List<Line> script, List<String> a, List<String> b, int offset) {
        int[][] lcs = new int[a.size() + 1][b.size() + 1];
        for (int i = a.size() - 1; i >= 0; i--) {
            for (int j = b.size() - 1; j >= 0; j--) {
                lcs[i][j] = a.get(i).equals(b.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int i = 0;
        int j = 0;
        while (i < a.size() || j < b.size()) {
            if (i < a.size() && j < b.size() && a.get(i).equals(b.get(j))) {
                script.add(new Line(' ', a.get(i), offset + i + 1, offset + j + 1));
                i++;
                j++;
            } else if (j < b.size() && (i == a.size() || lcs[i][j + 1] >= lcs[i + 1][j])) {
                script.add(new Line('+', b.get(j), offset + i + 1, offset + j + 1));
                j++;
            } else {
                script.add(new Line('-', a.get(i), offset + i + 1, offset + j + 1));
                i++;
            }
        }
    }

    /**
     * Changed region too large for the table: report it as removed, then added.
     */
    private static void replaced(List<Line> script, List<String> a, List<String> b, int offset) {
        for (int i = 0; i < a.size(); i++) {
            script.add(new Line('-', a.get(i), offset + i + 1, offset + 1));
        }
        for (int j = 0; j < b.size(); j++) {
            script.add(new Line('+', b.get(j), offset + a.size() + 1, offset + j + 1));
        }
    }

    private static List<String> lines(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(text.split("\\R", -1));
    }

    private record Line(char op, String text, int fromLine, int toLine) {
    }
}
