package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.selection.Selections;
import org.pragmatica.variation.selection.Selector;
import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes a dimension from the tree, keeping the content of the branches the selector activates.
 *
 * <p>Every choice on the dimension is replaced in place by the segments of its active branches, then-branch
 * first. Choices on other dimensions stay, with their branches searched for further occurrences.
 */
public final class DimensionDeleter implements TreeRewriter {
    private static final Logger logger = LoggerFactory.getLogger(DimensionDeleter.class);

    private final Selector selector;

    private DimensionDeleter(Selector selector) {
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    public static DimensionDeleter create(Selector selector) {
        return new DimensionDeleter(selector);
    }

    @Override
    public List<Segment> rewriteChoice(Choice choice) {
        if (!choice.name().equals(selector.name())) {
            return TreeRewriter.super.rewriteChoice(choice);
        }
        logger.debug("Collapsing {} choice on {} keeping {}", choice.kind(), choice.name(), selector.status());
        var kept = new ArrayList<Segment>();
        for (var branch : Branch.values()) {
            if (Selections.isBranchActive(choice, selector, branch)) {
                for (var segment : choice.branch(branch).segments()) {
                    kept.addAll(rewriteSegment(segment));
                }
            }
        }
        return kept;
    }
}
