package org.pragmatica.variation.error;

import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.SourcePosition;

/**
 * Structural edit that could not be applied.
 */
public sealed interface EditError {
    SourcePosition location();

    String message();

    /**
     * The branch an alternative was to be added to already holds content.
     */
    record AlternativeExists(
    SourcePosition location,
    String dimension,
    Branch branch) implements EditError {
        @Override
        public String message() {
            return "Alternative " + branch.name().toLowerCase() + " of " + dimension + " at " + location
                   + " already exists";
        }
    }
}
