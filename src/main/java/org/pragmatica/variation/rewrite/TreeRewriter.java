package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;
import org.pragmatica.variation.tree.SpanAnnotator;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-to-tree transform. Every segment is expanded into zero, one or many replacement siblings,
 * and regions are rebuilt from the concatenated replacements.
 *
 * <p>Operations override the steps they care about and keep the defaults elsewhere:
 * <ul>
 *   <li>{@link #rewriteContent} keeps the leaf as is</li>
 *   <li>{@link #rewriteChoice} rewrites both branches and keeps name and kind</li>
 *   <li>{@link #rewriteRegion} concatenates the replacements of every segment into a new region
 *       with the same visibility</li>
 * </ul>
 *
 * <p>The input tree is never modified.
 */
public interface TreeRewriter {

    /**
     * Rewrite {@code document} and position the result for the current view.
     */
    default Region rewriteDocument(Region document) {
        return SpanAnnotator.annotate(rewriteRegion(document));
    }

    default List<Segment> rewriteContent(Content content) {
        return List.of(content);
    }

    default List<Segment> rewriteChoice(Choice choice) {
        return List.of(choice.withBranches(rewriteRegion(choice.thenBranch()),
                                           rewriteRegion(choice.elseBranch())));
    }

    default Region rewriteRegion(Region region) {
        var rewritten = new ArrayList<Segment>();
        for (var segment : region.segments()) {
            rewritten.addAll(rewriteSegment(segment));
        }
        return region.withSegments(rewritten);
    }

    /**
     * Dispatch to the step matching the segment's shape.
     */
    default List<Segment> rewriteSegment(Segment segment) {
        if (segment instanceof Content content) {
            return rewriteContent(content);
        }
        if (segment instanceof Choice choice) {
            return rewriteChoice(choice);
        }
        throw new IllegalStateException("Unknown segment type: " + segment.getClass());
    }
}
