package org.pragmatica.variation.tree;

import org.pragmatica.variation.buffer.LiveMarker;

import java.util.Objects;
import java.util.Optional;

/**
 * Element of a {@link Region}: either literal text or a conditional choice.
 */
public sealed interface Segment {
    /**
     * Position of this segment in the current view.
     */
    Placement placement();

    /**
     * Copy of this segment placed at {@code placement}.
     */
    Segment withPlacement(Placement placement);

    /**
     * Copy of this segment with every placement in it cleared.
     */
    Segment withoutPlacement();

    /**
     * Literal text.
     *
     * @param content   the text
     * @param placement where the text sits in the current view
     * @param marker    externally owned live position of this text, consulted only by edit preservation
     */
    record Content(
    String content,
    Placement placement,
    Optional<LiveMarker> marker) implements Segment {
        public Content {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(placement, "placement");
            Objects.requireNonNull(marker, "marker");
        }

        public static Content text(String content) {
            return new Content(content, Placement.unpositioned(), Optional.empty());
        }

        public static Content tracked(String content, LiveMarker marker) {
            return new Content(content, Placement.unpositioned(), Optional.of(marker));
        }

        public Content withContent(String newContent) {
            return new Content(newContent, placement, marker);
        }

        @Override
        public Content withPlacement(Placement newPlacement) {
            return new Content(content, newPlacement, marker);
        }

        @Override
        public Content withoutPlacement() {
            return withPlacement(Placement.unpositioned());
        }
    }

    /**
     * Two-way conditional on a named dimension.
     *
     * @param name       the dimension
     * @param kind       which directive opened the choice, fixed for the life of the node
     * @param thenBranch region emitted right after the opening directive
     * @param elseBranch region emitted after {@code #else}, possibly empty
     * @param placement  where the whole choice, directive lines included, sits in the current view
     */
    record Choice(
    String name,
    ChoiceKind kind,
    Region thenBranch,
    Region elseBranch,
    Placement placement) implements Segment {
        public Choice {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(thenBranch, "thenBranch");
            Objects.requireNonNull(elseBranch, "elseBranch");
            Objects.requireNonNull(placement, "placement");
            if (name.isBlank()) {
                throw new IllegalArgumentException("Choice dimension name must not be blank");
            }
        }

        public static Choice of(String name, ChoiceKind kind, Region thenBranch, Region elseBranch) {
            return new Choice(name, kind, thenBranch, elseBranch, Placement.unpositioned());
        }

        public static Choice ifdef(String name, Region thenBranch, Region elseBranch) {
            return of(name, ChoiceKind.POSITIVE, thenBranch, elseBranch);
        }

        public static Choice ifndef(String name, Region thenBranch, Region elseBranch) {
            return of(name, ChoiceKind.CONTRAPOSITIVE, thenBranch, elseBranch);
        }

        public Region branch(Branch branch) {
            return branch == Branch.THEN ? thenBranch : elseBranch;
        }

        /**
         * Same dimension and kind with new branches. The placement is dropped since it no longer applies.
         */
        public Choice withBranches(Region newThen, Region newElse) {
            return new Choice(name, kind, newThen, newElse, Placement.unpositioned());
        }

        public Choice withBranch(Branch branch, Region region) {
            return branch == Branch.THEN
                   ? withBranches(region, elseBranch)
                   : withBranches(thenBranch, region);
        }

        @Override
        public Choice withPlacement(Placement newPlacement) {
            return new Choice(name, kind, thenBranch, elseBranch, newPlacement);
        }

        @Override
        public Choice withoutPlacement() {
            return new Choice(name,
                              kind,
                              thenBranch.withoutPlacement(),
                              elseBranch.withoutPlacement(),
                              Placement.unpositioned());
        }
    }
}
