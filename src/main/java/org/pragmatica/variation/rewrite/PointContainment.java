package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.tree.Placement;
import org.pragmatica.variation.tree.SourcePosition;
import org.pragmatica.variation.tree.SourceSpan;

/**
 * Point-in-span tests used to find the node an edit lands in.
 * Both tests exclude the start boundary; they differ only at the end boundary.
 * Unpositioned nodes contain nothing.
 */
public final class PointContainment {
    private PointContainment() {}

    /**
     * Start and end are both excluded, so a point sitting on a boundary belongs to neither neighbour.
     */
    public static boolean strictlyContains(Placement placement, SourcePosition point) {
        return placement.span()
                        .map(span -> strictlyContains(span, point))
                        .orElse(false);
    }

    public static boolean strictlyContains(SourceSpan span, SourcePosition point) {
        return span.start().isBefore(point) && point.isBefore(span.end());
    }

    /**
     * Start excluded, end included, so a point at the very end of a region still resolves into it.
     */
    public static boolean containsUpToEnd(Placement placement, SourcePosition point) {
        return placement.span()
                        .map(span -> containsUpToEnd(span, point))
                        .orElse(false);
    }

    public static boolean containsUpToEnd(SourceSpan span, SourcePosition point) {
        return span.start().isBefore(point) && !span.end().isBefore(point);
    }

    /**
     * True when the node is positioned and ends exactly at {@code point}.
     */
    public static boolean endsAt(Placement placement, SourcePosition point) {
        return placement.span()
                        .map(span -> span.end().equals(point))
                        .orElse(false);
    }
}
