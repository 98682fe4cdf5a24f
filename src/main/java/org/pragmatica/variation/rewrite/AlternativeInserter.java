package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.error.EditError;
import org.pragmatica.variation.error.EditException;
import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.SourcePosition;
import org.pragmatica.variation.tree.SpanAnnotator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Populates the empty branch of a choice.
 *
 * <p>The choice is found by its dimension name and by the point: the point must be exactly where the
 * target branch ends in the current view. The lookup includes span ends, so a point at the end of a
 * region still resolves into it.
 *
 * <p>Existing content is never overwritten: if the target branch holds anything, an {@link EditException}
 * carrying {@link EditError.AlternativeExists} is thrown and the input tree stays as it was.
 */
public final class AlternativeInserter implements TreeRewriter {
    private static final Logger logger = LoggerFactory.getLogger(AlternativeInserter.class);

    private final Segment alternative;
    private final SourcePosition location;
    private final Branch branch;
    private final String dimension;

    private AlternativeInserter(Segment alternative, SourcePosition location, Branch branch, String dimension) {
        this.alternative = Objects.requireNonNull(alternative, "alternative");
        this.location = Objects.requireNonNull(location, "location");
        this.branch = Objects.requireNonNull(branch, "branch");
        this.dimension = Objects.requireNonNull(dimension, "dimension");
    }

    public static AlternativeInserter create(Segment alternative,
                                             SourcePosition location,
                                             Branch branch,
                                             String dimension) {
        return new AlternativeInserter(alternative, location, branch, dimension);
    }

    @Override
    public Region rewriteDocument(Region document) {
        var positioned = SpanAnnotator.annotate(document);
        return SpanAnnotator.annotate(rewriteRegion(positioned));
    }

    @Override
    public Region rewriteRegion(Region region) {
        var rewritten = new ArrayList<Segment>();
        for (var segment : region.segments()) {
            if (PointContainment.containsUpToEnd(segment.placement(), location)) {
                rewritten.addAll(rewriteSegment(segment));
            } else {
                rewritten.add(segment);
            }
        }
        return region.withSegments(rewritten);
    }

    @Override
    public List<Segment> rewriteChoice(Choice choice) {
        if (!isTarget(choice)) {
            return List.of(choice.withBranches(rewriteRegion(choice.thenBranch()),
                                               rewriteRegion(choice.elseBranch())));
        }
        if (!choice.branch(branch).isEmpty()) {
            throw new EditException(new EditError.AlternativeExists(location, dimension, branch));
        }
        logger.debug("Adding {} alternative of {} at {}", branch, dimension, location);
        return List.of(choice.withBranch(branch, Region.of(alternative)));
    }

    private boolean isTarget(Choice choice) {
        return choice.name().equals(dimension)
               && PointContainment.endsAt(choice.branch(branch).placement(), location);
    }
}
