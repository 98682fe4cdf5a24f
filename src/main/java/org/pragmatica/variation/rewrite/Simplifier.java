package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Content;

import java.util.ArrayList;

/**
 * Merges runs of adjacent text leaves within a region into one leaf. Choices are never merged across.
 *
 * <p>A merged leaf has no live marker, since no single marker tracks the joined text.
 */
public final class Simplifier implements TreeRewriter {
    private static final Simplifier INSTANCE = new Simplifier();

    private Simplifier() {}

    public static Simplifier create() {
        return INSTANCE;
    }

    @Override
    public Region rewriteRegion(Region region) {
        var merged = new ArrayList<Segment>();
        for (var segment : region.segments()) {
            if (segment instanceof Content content) {
                append(merged, content);
            } else {
                merged.addAll(rewriteSegment(segment));
            }
        }
        return region.withSegments(merged);
    }

    private static void append(ArrayList<Segment> merged, Content content) {
        if (!merged.isEmpty() && merged.get(merged.size() - 1) instanceof Content last) {
            merged.set(merged.size() - 1, Content.text(last.content() + content.content()));
        } else {
            merged.add(content);
        }
    }
}
