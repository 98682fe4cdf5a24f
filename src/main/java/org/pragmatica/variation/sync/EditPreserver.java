package org.pragmatica.variation.sync;

import org.pragmatica.variation.buffer.TextBuffer;
import org.pragmatica.variation.selection.Selections;
import org.pragmatica.variation.selection.Selector;
import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls text the user edited in the live buffer back into the tree.
 *
 * <p>Every leaf reachable through visible, active branches takes the text its live marker currently covers.
 * Inactive or hidden branches keep their last known content until a later view shows them again.
 * Only leaf content changes: structure and placements are kept as they are.
 */
public final class EditPreserver {
    private static final Logger logger = LoggerFactory.getLogger(EditPreserver.class);

    private final TextBuffer buffer;
    private final List<Selector> selectors;

    private EditPreserver(TextBuffer buffer, List<Selector> selectors) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.selectors = List.copyOf(selectors);
    }

    public static EditPreserver create(TextBuffer buffer, List<Selector> selectors) {
        return new EditPreserver(buffer, selectors);
    }

    /**
     * Copy of {@code document} with visible leaf content refreshed from the buffer.
     */
    public Region preserve(Region document) {
        return region(document);
    }

    private Region region(Region region) {
        var refreshed = new ArrayList<Segment>(region.segments().size());
        for (var segment : region.segments()) {
            refreshed.add(segment(segment));
        }
        return new Region(refreshed, region.placement(), region.hidden());
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
        return content.marker()
                      .map(marker -> content.withContent(buffer.textInRange(marker.currentRange())))
                      .orElseGet(() -> {
                          logger.debug("Leaf at {} has no live marker, keeping its content", content.placement());
                          return content;
                      });
    }

    private Choice choice(Choice choice) {
        var selector = Selections.forChoice(choice, selectors);
        return new Choice(choice.name(),
                          choice.kind(),
                          branch(choice, selector, Branch.THEN),
                          branch(choice, selector, Branch.ELSE),
                          choice.placement());
    }

    private Region branch(Choice choice, Selector selector, Branch branch) {
        var region = choice.branch(branch);
        return Selections.isBranchActive(choice, selector, branch) && !region.hidden()
               ? region(region)
               : region;
    }
}
