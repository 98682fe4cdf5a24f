package org.pragmatica.variation.tree;

import java.util.Objects;

/**
 * A range in rendered text from start to end.
 * Whether a point sitting exactly on either boundary belongs to the span is decided by the caller.
 */
public record SourceSpan(SourcePosition start, SourcePosition end) {

    public SourceSpan {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static SourceSpan of(SourcePosition start, SourcePosition end) {
        return new SourceSpan(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
