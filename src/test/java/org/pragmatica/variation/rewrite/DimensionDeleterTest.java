package org.pragmatica.variation.rewrite;

import org.junit.jupiter.api.Test;
import org.pragmatica.variation.render.Renderer;
import org.pragmatica.variation.selection.Selector;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.variation.TestTrees.*;

class DimensionDeleterTest {

    private static Region document() {
        return region(text("a"), ifdef("FOO", region(text("T")), region(text("E"))), text("b"));
    }

    private static List<String> contents(Region region) {
        return region.segments()
                     .stream()
                     .map(segment -> segment instanceof Content content ? content.content() : "<choice>")
                     .toList();
    }

    @Test
    void def_keepsThenBranchInPlace() {
        var result = DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(document());

        assertThat(contents(result)).containsExactly("a", "T", "b");
        assertContiguous(result);
    }

    @Test
    void ndef_keepsElseBranchOwnSegments() {
        var result = DimensionDeleter.create(Selector.undefined("FOO")).rewriteDocument(document());

        assertThat(contents(result)).containsExactly("a", "E", "b");
    }

    @Test
    void both_keepsThenFollowedByElse() {
        var result = DimensionDeleter.create(Selector.both("FOO")).rewriteDocument(document());

        assertThat(contents(result)).containsExactly("a", "T", "E", "b");
    }

    @Test
    void def_onContrapositiveChoice_keepsElseBranch() {
        var document = region(ifndef("FOO", region(text("T")), region(text("E"))));

        var result = DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(document);

        assertThat(contents(result)).containsExactly("E");
    }

    @Test
    void eachBranch_survivesWithItsOwnSegments() {
        var document = region(ifdef("FOO", region(text("t1"), text("t2")), region(text("e1"))));

        var defined = DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(document);
        var undefined = DimensionDeleter.create(Selector.undefined("FOO")).rewriteDocument(document);

        assertThat(contents(defined)).containsExactly("t1", "t2");
        assertThat(contents(undefined)).containsExactly("e1");
    }

    @Test
    void otherDimensions_areKept() {
        var document = region(ifdef("BAR", region(text("x")), region(text("y"))));

        var result = DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(document);

        assertThat(Renderer.renderCanonical(result)).isEqualTo("\n#ifdef BAR\nx\n#else\ny\n#endif");
    }

    @Test
    void nestedOccurrence_insideOtherDimension_isDeleted() {
        var document = region(ifdef("BAR",
                                    region(text("x"), ifdef("FOO", region(text("T")), region(text("E")))),
                                    Region.empty()));

        var result = DimensionDeleter.create(Selector.undefined("FOO")).rewriteDocument(document);

        var bar = (Choice) result.segments().get(0);
        assertThat(bar.name()).isEqualTo("BAR");
        assertThat(contents(bar.thenBranch())).containsExactly("x", "E");
    }

    @Test
    void nestedOccurrence_insideSameDimension_isDeletedToo() {
        var document = region(ifdef("FOO",
                                    region(ifdef("FOO", region(text("inner")), region(text("other")))),
                                    region(text("E"))));

        var result = DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(document);

        assertThat(contents(result)).containsExactly("inner");
    }

    @Test
    void deletion_leavesInputUntouched() {
        var original = document();

        DimensionDeleter.create(Selector.defined("FOO")).rewriteDocument(original);

        assertThat(original.segments().get(1)).isInstanceOf(Segment.Choice.class);
        assertThat(original).isEqualTo(document());
    }
}
