package org.pragmatica.variation.render;

import org.pragmatica.variation.tree.ChoiceKind;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;
import org.pragmatica.variation.tree.SpanAnnotator;

/**
 * Turns a tree back into text.
 *
 * <ul>
 *   <li>{@link #renderVisible} produces the view: hidden branches are skipped and each directive line
 *       is reduced to a bare newline, exactly as {@link SpanAnnotator} counts positions.</li>
 *   <li>{@link #renderCanonical} reconstructs full concrete syntax and ignores the view entirely.</li>
 * </ul>
 */
public final class Renderer {
    private Renderer() {}

    public static String renderVisible(Region region) {
        var sb = new StringBuilder();
        appendVisible(sb, region);
        return sb.toString();
    }

    private static void appendVisible(StringBuilder sb, Region region) {
        if (region.hidden()) {
            return;
        }
        for (var segment : region.segments()) {
            if (segment instanceof Content content) {
                sb.append(content.content());
            } else if (segment instanceof Choice choice) {
                appendVisibleBranch(sb, choice.thenBranch());
                appendVisibleBranch(sb, choice.elseBranch());
                sb.append('\n');
            }
        }
    }

    private static void appendVisibleBranch(StringBuilder sb, Region branch) {
        if (SpanAnnotator.rendersVisibly(branch)) {
            sb.append('\n');
            appendVisible(sb, branch);
        }
    }

    public static String renderCanonical(Region region) {
        return renderCanonical(region, SyntaxConfig.DEFAULT);
    }

    /**
     * Concrete syntax for the full tree, hidden branches included.
     * A segment that directly follows a choice always starts on a fresh line.
     */
    public static String renderCanonical(Region region, SyntaxConfig config) {
        var sb = new StringBuilder();
        Segment previous = null;
        for (var segment : region.segments()) {
            var text = canonical(segment, config);
            if (previous instanceof Choice) {
                text = onNewLine(text);
            }
            sb.append(text);
            previous = segment;
        }
        return sb.toString();
    }

    private static String canonical(Segment segment, SyntaxConfig config) {
        if (segment instanceof Content content) {
            return content.content();
        }
        if (segment instanceof Choice choice) {
            return canonicalChoice(choice, config);
        }
        throw new IllegalStateException("Unknown segment type: " + segment.getClass());
    }

    private static String canonicalChoice(Choice choice, SyntaxConfig config) {
        var directive = choice.kind() == ChoiceKind.POSITIVE
                        ? config.ifdefDirective()
                        : config.ifndefDirective();
        var sb = new StringBuilder()
            .append('\n')
            .append(directive)
            .append(' ')
            .append(choice.name())
            .append(onNewLine(renderCanonical(choice.thenBranch(), config)));
        if (!choice.elseBranch().isEmpty()) {
            sb.append('\n')
              .append(config.elseDirective())
              .append(onNewLine(renderCanonical(choice.elseBranch(), config)));
        }
        return sb.append('\n')
                 .append(config.endifDirective())
                 .toString();
    }

    private static String onNewLine(String text) {
        return text.startsWith("\n") ? text : "\n" + text;
    }
}
