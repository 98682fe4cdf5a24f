package org.pragmatica.variation.buffer;

import org.pragmatica.variation.tree.SourceSpan;

/**
 * Externally owned handle tracking where a piece of text currently lives in an editing buffer.
 * The tree only holds a reference; it never moves or invalidates the marker.
 */
@FunctionalInterface
public interface LiveMarker {

    /**
     * Current range of the tracked text in the buffer.
     */
    SourceSpan currentRange();
}
