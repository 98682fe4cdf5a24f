package org.pragmatica.variation.tree;

import java.util.List;
import java.util.Objects;

/**
 * Ordered body of text and choice segments.
 * A hidden region keeps all of its segments but takes no room in the rendered view,
 * so it is never positioned.
 */
public record Region(
    List<Segment> segments,
    Placement placement,
    boolean hidden
) {
    public Region {
        Objects.requireNonNull(placement, "placement");
        segments = List.copyOf(segments);
        if (hidden && placement.isPositioned()) {
            throw new IllegalArgumentException("Hidden region cannot be positioned");
        }
    }

    public static Region of(Segment... segments) {
        return new Region(List.of(segments), Placement.unpositioned(), false);
    }

    public static Region of(List<? extends Segment> segments) {
        return new Region(List.copyOf(segments), Placement.unpositioned(), false);
    }

    public static Region empty() {
        return of();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * Hidden copy of this region. Segments are kept but lose their positions.
     */
    public Region hide() {
        return new Region(withoutPlacement().segments, Placement.unpositioned(), true);
    }

    /**
     * Visible copy of this region, unpositioned until the next annotation.
     */
    public Region show() {
        return new Region(segments, Placement.unpositioned(), false);
    }

    /**
     * Region with the same visibility holding {@code newSegments}.
     */
    public Region withSegments(List<? extends Segment> newSegments) {
        return new Region(List.copyOf(newSegments), Placement.unpositioned(), hidden);
    }

    public Region withPlacement(Placement newPlacement) {
        return new Region(segments, newPlacement, hidden);
    }

    /**
     * Deep copy with every placement cleared.
     */
    public Region withoutPlacement() {
        return new Region(segments.stream()
                                  .map(Segment::withoutPlacement)
                                  .toList(),
                          Placement.unpositioned(),
                          hidden);
    }
}
