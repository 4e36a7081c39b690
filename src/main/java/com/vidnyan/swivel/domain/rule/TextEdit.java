package com.vidnyan.swivel.domain.rule;

import java.util.Objects;

/**
 * Replace {@code span} with {@code replacement}. An empty span is an insertion.
 */
public record TextEdit(TextSpan span, String replacement) {

    public TextEdit {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(replacement, "replacement");
    }

    public static TextEdit insert(int offset, String text) {
        return new TextEdit(TextSpan.at(offset), text);
    }

    public static TextEdit delete(int start, int end) {
        return new TextEdit(new TextSpan(start, end), "");
    }
}
