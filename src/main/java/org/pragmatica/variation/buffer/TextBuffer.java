package org.pragmatica.variation.buffer;

import org.pragmatica.variation.tree.SourceSpan;

/**
 * Live text surface the rendered view is shown in.
 * Queried at the moment of use and never cached, because it may be edited between passes.
 */
@FunctionalInterface
public interface TextBuffer {

    /**
     * Text currently displayed in {@code range}.
     */
    String textInRange(SourceSpan range);
}
