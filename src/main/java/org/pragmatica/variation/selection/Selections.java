package org.pragmatica.variation.selection;

import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.ChoiceKind;
import org.pragmatica.variation.tree.Segment.Choice;

import java.util.List;

/**
 * Selector lookup and the branch activity table.
 *
 * <pre>
 * status | THEN active when kind | ELSE active when kind
 * BOTH   | always                | always
 * DEF    | POSITIVE              | CONTRAPOSITIVE
 * NDEF   | CONTRAPOSITIVE        | POSITIVE
 * </pre>
 */
public final class Selections {
    private Selections() {}

    /**
     * Selector for {@code dimension}; a dimension nobody selected shows both branches.
     */
    public static Selector forDimension(String dimension, List<Selector> selectors) {
        for (var selector : selectors) {
            if (selector.name().equals(dimension)) {
                return selector;
            }
        }
        return Selector.both(dimension);
    }

    public static Selector forChoice(Choice choice, List<Selector> selectors) {
        return forDimension(choice.name(), selectors);
    }

    /**
     * Whether {@code branch} of {@code choice} is shown under {@code selector}. A missing selector activates nothing.
     */
    public static boolean isBranchActive(Choice choice, Selector selector, Branch branch) {
        if (selector == null) {
            return false;
        }
        return isBranchActive(choice.kind(), selector.status(), branch);
    }

    public static boolean isBranchActive(ChoiceKind kind, Status status, Branch branch) {
        return switch (status) {
            case BOTH -> true;
            case DEF -> (branch == Branch.THEN) == (kind == ChoiceKind.POSITIVE);
            case NDEF -> (branch == Branch.THEN) == (kind == ChoiceKind.CONTRAPOSITIVE);
        };
    }
}
