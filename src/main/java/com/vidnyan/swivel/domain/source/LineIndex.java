package com.vidnyan.swivel.domain.source;

import com.github.javaparser.Position;
import com.github.javaparser.Range;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps parser positions (1-based line and column) to character offsets in the source text.
 * JavaParser counts a tab as one column, so columns map directly to characters.
 */
public final class LineIndex {

    private final String text;
    private final List<Integer> lineStarts = new ArrayList<>();

    public LineIndex(String text) {
        this.text = text;
        lineStarts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                lineStarts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                lineStarts.add(i + 1);
            }
        }
    }

    public int lineCount() {
        return lineStarts.size();
    }

    public int offsetOf(Position position) {
        return offsetOf(position.line, position.column);
    }

    public int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.size()) {
            throw new IndexOutOfBoundsException("Line " + line + " outside 1.." + lineStarts.size());
        }
        return Math.min(lineStarts.get(line - 1) + column - 1, text.length());
    }

    /**
     * Offset just past the last character of a range (ranges are inclusive in JavaParser).
     */
    public int endOffsetOf(Range range) {
        return Math.min(offsetOf(range.end) + 1, text.length());
    }

    public int lineStart(int line) {
        return offsetOf(line, 1);
    }

    /**
     * Offset just past the line terminator of {@code line}, or the end of text on the last line.
     */
    public int nextLineStart(int line) {
        return line < lineStarts.size() ? lineStarts.get(line) : text.length();
    }

    /**
     * Leading whitespace of a line.
     */
    public String indentationOf(int line) {
        int start = lineStart(line);
        int end = start;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(start, end);
    }

    /**
     * True when nothing but whitespace surrounds {@code [start, end)} on its line.
     */
    public boolean occupiesWholeLine(int line, int start, int end) {
        int lineEnd = nextLineStart(line);
        return text.substring(lineStart(line), start).isBlank()
                && text.substring(end, lineEnd).isBlank();
    }

    /**
     * True when only whitespace follows {@code offset} up to the end of {@code line}.
     */
    public boolean restOfLineIsBlank(int line, int offset) {
        return text.substring(offset, nextLineStart(line)).isBlank();
    }

    public String lineSeparator() {
        int newline = text.indexOf('\n');
        if (newline > 0 && text.charAt(newline - 1) == '\r') {
            return "\r\n";
        }
        return "\n";
    }
}
