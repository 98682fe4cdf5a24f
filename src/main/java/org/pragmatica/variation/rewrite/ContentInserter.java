package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.buffer.TextBuffer;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;
import org.pragmatica.variation.tree.SourcePosition;
import org.pragmatica.variation.tree.SourceSpan;
import org.pragmatica.variation.tree.SpanAnnotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inserts a new segment in the middle of the text leaf that strictly contains a point of the view.
 *
 * <p>The leaf is split in three: the text before the point, the new segment, and the text after it.
 * Both text pieces are read from the live buffer, since the leaf content may lag behind what the user
 * typed. A point sitting exactly on a span boundary matches nothing there, and the tree is left as is.
 */
public final class ContentInserter implements TreeRewriter {
    private static final Logger logger = LoggerFactory.getLogger(ContentInserter.class);

    private final Segment inserted;
    private final SourcePosition location;
    private final TextBuffer buffer;

    private ContentInserter(Segment inserted, SourcePosition location, TextBuffer buffer) {
        this.inserted = Objects.requireNonNull(inserted, "inserted");
        this.location = Objects.requireNonNull(location, "location");
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    public static ContentInserter create(Segment inserted, SourcePosition location, TextBuffer buffer) {
        return new ContentInserter(inserted, location, buffer);
    }

    /**
     * Spans carry meaning here, so the tree is positioned before the point is looked up and again after the edit.
     */
    @Override
    public Region rewriteDocument(Region document) {
        var positioned = SpanAnnotator.annotate(document);
        return SpanAnnotator.annotate(rewriteRegion(positioned));
    }

    @Override
    public Region rewriteRegion(Region region) {
        var rewritten = new ArrayList<Segment>();
        for (var segment : region.segments()) {
            if (PointContainment.strictlyContains(segment.placement(), location)) {
                rewritten.addAll(rewriteSegment(segment));
            } else {
                rewritten.add(segment);
            }
        }
        return region.withSegments(rewritten);
    }

    @Override
    public List<Segment> rewriteChoice(Choice choice) {
        return List.of(choice.withBranches(descend(choice.thenBranch()), descend(choice.elseBranch())));
    }

    private Region descend(Region branch) {
        return PointContainment.strictlyContains(branch.placement(), location)
               ? rewriteRegion(branch)
               : branch;
    }

    @Override
    public List<Segment> rewriteContent(Content content) {
        var span = content.placement()
                          .span()
                          .orElseThrow(() -> new IllegalStateException("Unpositioned leaf matched " + location));
        logger.debug("Splitting leaf {} at {}", span, location);
        var before = Content.text(buffer.textInRange(SourceSpan.of(span.start(), location)) + "\n");
        var after = Content.text(buffer.textInRange(SourceSpan.of(location, span.end())));
        return List.of(before, inserted, after);
    }
}
