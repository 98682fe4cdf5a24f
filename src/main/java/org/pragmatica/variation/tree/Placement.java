package org.pragmatica.variation.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * Where a node currently sits in the rendered text.
 * Nodes start out {@link Unpositioned}; the {@link SpanAnnotator} positions every visible node
 * and leaves hidden ones unpositioned.
 */
public sealed interface Placement {

    Placement UNPOSITIONED = new Unpositioned();

    static Placement unpositioned() {
        return UNPOSITIONED;
    }

    static Placement positioned(SourceSpan span) {
        return new Positioned(span);
    }

    /**
     * The span, if positioned.
     */
    Optional<SourceSpan> span();

    default boolean isPositioned() {
        return span().isPresent();
    }

    /**
     * Not part of the current view, or not annotated yet.
     */
    record Unpositioned() implements Placement {
        @Override
        public Optional<SourceSpan> span() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "<unpositioned>";
        }
    }

    /**
     * Occupies {@code span} in the current view.
     */
    record Positioned(SourceSpan value) implements Placement {
        public Positioned {
            Objects.requireNonNull(value, "span");
        }

        @Override
        public Optional<SourceSpan> span() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
