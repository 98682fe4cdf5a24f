package org.pragmatica.variation.tree;

/**
 * A position in rendered text (row and column, both 0-based).
 * The column counts characters since the last newline.
 */
public record SourcePosition(int row, int column) implements Comparable<SourcePosition> {

    public static final SourcePosition START = new SourcePosition(0, 0);

    public SourcePosition {
        if (row < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position " + row + ":" + column);
        }
    }

    public static SourcePosition at(int row, int column) {
        return new SourcePosition(row, column);
    }

    /**
     * Position reached after emitting {@code text} starting at this position.
     */
    public SourcePosition advance(String text) {
        var lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            return new SourcePosition(row, column + text.length());
        }
        var newlines = (int) text.chars()
                                 .filter(c -> c == '\n')
                                 .count();
        return new SourcePosition(row + newlines, text.length() - lastNewline - 1);
    }

    public boolean isBefore(SourcePosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(SourcePosition other) {
        return row != other.row
               ? Integer.compare(row, other.row)
               : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return row + ":" + column;
    }
}
