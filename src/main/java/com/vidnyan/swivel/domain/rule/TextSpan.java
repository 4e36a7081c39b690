package com.vidnyan.swivel.domain.rule;

/**
 * Half-open character range {@code [start, end)} of a source snapshot.
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static TextSpan at(int offset) {
        return new TextSpan(offset, offset);
    }

    /**
     * Spans that overlap or touch claim the same region. An insertion at the boundary of
     * another span therefore conflicts with it.
     */
    public boolean touches(TextSpan other) {
        return start <= other.end && other.start <= end;
    }

    public boolean contains(TextSpan other) {
        return start <= other.start && other.end <= end;
    }

    public TextSpan union(TextSpan other) {
        return new TextSpan(Math.min(start, other.start), Math.max(end, other.end));
    }
}
