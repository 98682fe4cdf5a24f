package org.pragmatica.variation.rewrite;

import org.pragmatica.variation.selection.Selections;
import org.pragmatica.variation.selection.Selector;
import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;

import java.util.List;

/**
 * Hides the branches the selectors do not ask for.
 * Hidden branches keep their content; every choice yields exactly one replacement.
 */
public final class ViewFilter implements TreeRewriter {
    private final List<Selector> selectors;

    private ViewFilter(List<Selector> selectors) {
        this.selectors = List.copyOf(selectors);
    }

    public static ViewFilter create(List<Selector> selectors) {
        return new ViewFilter(selectors);
    }

    @Override
    public List<Segment> rewriteChoice(Choice choice) {
        var selector = Selections.forChoice(choice, selectors);
        return List.of(choice.withBranches(filter(choice, selector, Branch.THEN),
                                           filter(choice, selector, Branch.ELSE)));
    }

    private Region filter(Choice choice, Selector selector, Branch branch) {
        var region = choice.branch(branch);
        return Selections.isBranchActive(choice, selector, branch)
               ? rewriteRegion(region).show()
               : region.hide();
    }
}
