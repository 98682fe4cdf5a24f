package org.pragmatica.variation.render;

import java.util.Objects;

/**
 * Directive keywords used when rendering canonical concrete syntax.
 */
public record SyntaxConfig(
    String ifdefDirective,
    String ifndefDirective,
    String elseDirective,
    String endifDirective
) {
    public static final SyntaxConfig DEFAULT = new SyntaxConfig(
        "#ifdef",
        "#ifndef",
        "#else",
        "#endif"
    );

    public SyntaxConfig {
        Objects.requireNonNull(ifdefDirective, "ifdefDirective");
        Objects.requireNonNull(ifndefDirective, "ifndefDirective");
        Objects.requireNonNull(elseDirective, "elseDirective");
        Objects.requireNonNull(endifDirective, "endifDirective");
    }
}
