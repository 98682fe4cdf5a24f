package org.pragmatica.variation.render;

import org.junit.jupiter.api.Test;
import org.pragmatica.variation.tree.Region;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.variation.TestTrees.*;

class RendererTest {

    // === Canonical ===

    @Test
    void canonical_positiveChoice_withElse() {
        var document = region(ifdef("FOO", region(text("A")), region(text("B"))));

        assertThat(Renderer.renderCanonical(document)).isEqualTo("\n#ifdef FOO\nA\n#else\nB\n#endif");
    }

    @Test
    void canonical_contrapositiveChoice_withoutElse() {
        var document = region(ifndef("BAR", region(text("A")), Region.empty()));

        assertThat(Renderer.renderCanonical(document)).isEqualTo("\n#ifndef BAR\nA\n#endif");
    }

    @Test
    void canonical_branchAlreadyOnNewLine_getsNoExtraNewline() {
        var document = region(ifdef("FOO", region(text("\nA")), Region.empty()));

        assertThat(Renderer.renderCanonical(document)).isEqualTo("\n#ifdef FOO\nA\n#endif");
    }

    @Test
    void canonical_textAfterChoice_startsOnFreshLine() {
        var document = region(text("a"), ifdef("FOO", region(text("A")), Region.empty()), text("b"));

        assertThat(Renderer.renderCanonical(document)).isEqualTo("a\n#ifdef FOO\nA\n#endif\nb");
    }

    @Test
    void canonical_customDirectives() {
        var config = new SyntaxConfig("%if", "%ifnot", "%otherwise", "%end");
        var document = region(ifndef("FOO", region(text("A")), region(text("B"))));

        assertThat(Renderer.renderCanonical(document, config)).isEqualTo("\n%ifnot FOO\nA\n%otherwise\nB\n%end");
    }

    @Test
    void canonical_ignoresHiddenFlags() {
        var document = region(ifdef("FOO", region(text("A")).hide(), region(text("B")).hide()));

        assertThat(Renderer.renderCanonical(document)).isEqualTo("\n#ifdef FOO\nA\n#else\nB\n#endif");
    }

    // === Visible ===

    @Test
    void visible_replacesDirectivesWithNewlines() {
        var document = region(text("a"), ifdef("FOO", region(text("A")), region(text("B"))), text("b"));

        assertThat(Renderer.renderVisible(document)).isEqualTo("a\nA\nB\nb");
    }

    @Test
    void visible_skipsHiddenAndEmptyBranches() {
        var document = region(ifdef("FOO", region(text("A")).hide(), Region.empty()));

        assertThat(Renderer.renderVisible(document)).isEqualTo("\n");
    }
}
