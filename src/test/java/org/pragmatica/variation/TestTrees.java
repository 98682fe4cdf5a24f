package org.pragmatica.variation;

import org.pragmatica.variation.buffer.TextBuffer;
import org.pragmatica.variation.tree.ChoiceKind;
import org.pragmatica.variation.tree.Region;
import org.pragmatica.variation.tree.Segment;
import org.pragmatica.variation.tree.Segment.Choice;
import org.pragmatica.variation.tree.Segment.Content;
import org.pragmatica.variation.tree.SourcePosition;
import org.pragmatica.variation.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tree builders, a minimal directive parser and a string-backed buffer for tests.
 *
 * The parser treats every directive as "\n#keyword [NAME]" and keeps the text between directives verbatim,
 * which is the shape the canonical renderer reproduces.
 */
public final class TestTrees {
    private static final Pattern DIRECTIVE = Pattern.compile("\n#(ifdef|ifndef|else|endif)(?: (\\w+))?");

    private TestTrees() {}

    public static Content text(String content) {
        return Content.text(content);
    }

    public static Region region(Segment... segments) {
        return Region.of(segments);
    }

    public static Choice ifdef(String name, Region thenBranch, Region elseBranch) {
        return Choice.ifdef(name, thenBranch, elseBranch);
    }

    public static Choice ifndef(String name, Region thenBranch, Region elseBranch) {
        return Choice.ifndef(name, thenBranch, elseBranch);
    }

    public static SourcePosition pos(int row, int column) {
        return SourcePosition.at(row, column);
    }

    public static SourceSpan span(int startRow, int startColumn, int endRow, int endColumn) {
        return SourceSpan.of(pos(startRow, startColumn), pos(endRow, endColumn));
    }

    /**
     * Buffer showing {@code text}, addressed by row and column.
     */
    public static TextBuffer buffer(String text) {
        return range -> text.substring(offset(text, range.start()), offset(text, range.end()));
    }

    private static int offset(String text, SourcePosition position) {
        var offset = 0;
        for (int row = 0; row < position.row(); row++) {
            offset = text.indexOf('\n', offset) + 1;
        }
        return offset + position.column();
    }

    // === Parsing ===

    private sealed interface Token {}

    private record Text(String text) implements Token {}

    private record Directive(String keyword, String name) implements Token {}

    public static Region parse(String source) {
        var tokens = tokenize(source);
        var cursor = new int[]{0};
        var segments = parseSegments(tokens, cursor);
        if (cursor[0] != tokens.size()) {
            throw new IllegalArgumentException("Unbalanced directive in: " + source);
        }
        return Region.of(segments);
    }

    private static List<Token> tokenize(String source) {
        var tokens = new ArrayList<Token>();
        var matcher = DIRECTIVE.matcher(source);
        var last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                tokens.add(new Text(source.substring(last, matcher.start())));
            }
            tokens.add(new Directive(matcher.group(1), matcher.group(2)));
            last = matcher.end();
        }
        if (last < source.length()) {
            tokens.add(new Text(source.substring(last)));
        }
        return tokens;
    }

    private static List<Segment> parseSegments(List<Token> tokens, int[] cursor) {
        var segments = new ArrayList<Segment>();
        while (cursor[0] < tokens.size()) {
            var token = tokens.get(cursor[0]);
            if (token instanceof Text text) {
                segments.add(Content.text(text.text()));
                cursor[0]++;
            } else if (token instanceof Directive directive && directive.name() != null) {
                cursor[0]++;
                segments.add(parseChoice(directive, tokens, cursor));
            } else {
                return segments;
            }
        }
        return segments;
    }

    private static Choice parseChoice(Directive opening, List<Token> tokens, int[] cursor) {
        var kind = opening.keyword().equals("ifdef") ? ChoiceKind.POSITIVE : ChoiceKind.CONTRAPOSITIVE;
        var thenBranch = Region.of(parseSegments(tokens, cursor));
        var elseBranch = Region.empty();
        if (keywordAt(tokens, cursor[0], "else")) {
            cursor[0]++;
            elseBranch = Region.of(parseSegments(tokens, cursor));
        }
        if (!keywordAt(tokens, cursor[0], "endif")) {
            throw new IllegalArgumentException("Missing #endif for " + opening.name());
        }
        cursor[0]++;
        return Choice.of(opening.name(), kind, thenBranch, elseBranch);
    }

    private static boolean keywordAt(List<Token> tokens, int index, String keyword) {
        return index < tokens.size()
               && tokens.get(index) instanceof Directive directive
               && directive.keyword().equals(keyword);
    }

    // === Assertions ===

    /**
     * Every visible region is positioned and its segments follow each other without gaps or overlaps.
     */
    public static void assertContiguous(Region region) {
        if (region.hidden()) {
            assertThat(region.placement().isPositioned()).isFalse();
            return;
        }
        var regionSpan = region.placement().span().orElseThrow();
        var cursor = regionSpan.start();
        for (var segment : region.segments()) {
            var segmentSpan = segment.placement().span().orElseThrow();
            assertThat(segmentSpan.start()).isEqualTo(cursor);
            cursor = segmentSpan.end();
            if (segment instanceof Choice choice) {
                assertContiguous(choice.thenBranch());
                assertContiguous(choice.elseBranch());
            }
        }
        assertThat(cursor).isEqualTo(regionSpan.end());
    }
}
