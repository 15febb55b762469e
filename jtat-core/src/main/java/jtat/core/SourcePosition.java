package jtat.core;

/// A 1-based `(line, column)` location in original source text.
public record SourcePosition(int line, int column) implements Comparable<SourcePosition> {

    public static final SourcePosition START = new SourcePosition(1, 1);

    public SourcePosition {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got: " + line);
        }
        if (column < 1) {
            throw new IllegalArgumentException("column must be >= 1, got: " + column);
        }
    }

    /// First column of the line after this one.
    public SourcePosition nextLine() {
        return new SourcePosition(line + 1, 1);
    }

    @Override
    public int compareTo(SourcePosition other) {
        final int byLine = Integer.compare(line, other.line);
        return byLine != 0 ? byLine : Integer.compare(column, other.column);
    }

    public boolean isBefore(SourcePosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
