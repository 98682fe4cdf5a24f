package org.pragmatica.variation.tree;

import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;

import java.util.ArrayList;

/**
 * Computes where every node lands in the rendered view.
 *
 * <p>Traversal is depth-first, left to right, and follows exactly what the visible renderer emits.
 * Directive lines ({@code #ifdef}, {@code #else}, {@code #endif}) are not content nodes, yet each one
 * still occupies a line of the view: one newline is consumed before a visible non-empty then-branch,
 * one before a visible non-empty else-branch and one after both.
 *
 * <p>Hidden regions take no room. They and everything inside them come back unpositioned.
 *
 * <p>Annotation never mutates its input; it returns a positioned copy of the tree.
 */
public final class SpanAnnotator {
    private SourcePosition current;

    private SpanAnnotator(SourcePosition start) {
        this.current = start;
    }

    /**
     * Positioned copy of {@code document}, starting at row 0, column 0.
     */
    public static Region annotate(Region document) {
        return annotate(document, SourcePosition.START);
    }

    /**
     * Positioned copy of {@code document}, starting at {@code start}.
     */
    public static Region annotate(Region document, SourcePosition start) {
        return new SpanAnnotator(start).region(document);
    }

    private Region region(Region region) {
        if (region.hidden()) {
            return region.hide();
        }
        var start = current;
        var positioned = new ArrayList<Segment>(region.segments().size());
        for (var segment : region.segments()) {
            positioned.add(segment(segment));
        }
        return new Region(positioned, Placement.positioned(SourceSpan.of(start, current)), false);
    }

    private Segment segment(Segment segment) {
        if (segment instanceof Content content) {
            return content(content);
        }
        if (segment instanceof Choice choice) {
            return choice(choice);
        }
        throw new IllegalStateException("Unknown segment type: " + segment.getClass());
    }

    private Content content(Content content) {
        var start = current;
        current = current.advance(content.content());
        return content.withPlacement(Placement.positioned(SourceSpan.of(start, current)));
    }

    private Choice choice(Choice choice) {
        var start = current;
        if (rendersVisibly(choice.thenBranch())) {
            current = current.advance("\n");
        }
        var thenBranch = region(choice.thenBranch());
        if (rendersVisibly(choice.elseBranch())) {
            current = current.advance("\n");
        }
        var elseBranch = region(choice.elseBranch());
        current = current.advance("\n");
        return new Choice(choice.name(),
                          choice.kind(),
                          thenBranch,
                          elseBranch,
                          Placement.positioned(SourceSpan.of(start, current)));
    }

    /**
     * True when the region is shown in the view and has something to show.
     */
    public static boolean rendersVisibly(Region region) {
        return !region.hidden() && !region.isEmpty();
    }
}
