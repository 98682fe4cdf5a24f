package org.pragmatica.variation;

import org.pragmatica.variation.buffer.TextBuffer;
import org.pragmatica.variation.render.Renderer;
import org.pragmatica.variation.render.SyntaxConfig;
import org.pragmatica.variation.rewrite.AlternativeInserter;
import org.pragmatica.variation.rewrite.ContentInserter;
import org.pragmatica.variation.rewrite.DimensionDeleter;
import org.pragmatica.variation.rewrite.Simplifier;
import org.pragmatica.variation.rewrite.ViewFilter;
import org.pragmatica.variation.selection.Selector;
import org.pragmatica.variation.sync.EditPreserver;
import org.pragmatica.variation.tree.Branch;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.SourcePosition;
import org.pragmatica.variation.tree.SpanAnnotator;

import java.util.List;

/**
 * Entry point for working with trees of conditionally compiled text.
 *
 * <p>Every structural operation returns a new, positioned tree and leaves its input untouched.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = Region.of(Choice.ifdef("FOO", Region.of(Content.text("A")), Region.of(Content.text("B"))));
 *
 * var view = VariationTree.filter(document, List.of(Selector.defined("FOO")));
 * VariationTree.renderVisible(view);     // "\nA\n"
 * VariationTree.renderCanonical(view);   // "\n#ifdef FOO\nA\n#else\nB\n#endif"
 * }</pre>
 */
public final class VariationTree {
    private VariationTree() {}

    /**
     * Position every visible node of {@code document}.
     */
    public static Region annotate(Region document) {
        return SpanAnnotator.annotate(document);
    }

    /**
     * Hide the branches {@code selectors} do not select. Dimensions without a selector show both branches.
     */
    public static Region filter(Region document, List<Selector> selectors) {
        return ViewFilter.create(selectors)
                         .rewriteDocument(document);
    }

    /**
     * Insert {@code segment} into the text leaf strictly containing {@code location}, splitting it.
     */
    public static Region insertContent(Region document, SourcePosition location, Segment segment, TextBuffer buffer) {
        return ContentInserter.create(segment, location, buffer)
                              .rewriteDocument(document);
    }

    /**
     * Fill the empty {@code branch} of the {@code dimension} choice ending at {@code location}.
     *
     * @throws org.pragmatica.variation.error.EditException if that branch already has content
     */
    public static Region insertAlternative(Region document,
                                           SourcePosition location,
                                           Segment alternative,
                                           Branch branch,
                                           String dimension) {
        return AlternativeInserter.create(alternative, location, branch, dimension)
                                  .rewriteDocument(document);
    }

    /**
     * Remove every choice on the selector's dimension, keeping the branches it activates.
     */
    public static Region deleteDimension(Region document, Selector selector) {
        return DimensionDeleter.create(selector)
                               .rewriteDocument(document);
    }

    /**
     * Merge adjacent text leaves.
     */
    public static Region simplify(Region document) {
        return Simplifier.create()
                         .rewriteDocument(document);
    }

    /**
     * Refresh visible leaf content from the live buffer.
     */
    public static Region preserveEdits(Region document, TextBuffer buffer, List<Selector> selectors) {
        return EditPreserver.create(buffer, selectors)
                            .preserve(document);
    }

    public static String renderVisible(Region document) {
        return Renderer.renderVisible(document);
    }

    public static String renderCanonical(Region document) {
        return Renderer.renderCanonical(document);
    }

    public static String renderCanonical(Region document, SyntaxConfig config) {
        return Renderer.renderCanonical(document, config);
    }
}
