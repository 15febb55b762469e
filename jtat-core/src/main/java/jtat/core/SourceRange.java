package jtat.core;

import java.util.Objects;

/// Where a node was found in the original source.
///
/// @param begin first character of the node
/// @param end last character of the node, inclusive; null when the parser reports start positions only
public record SourceRange(SourcePosition begin, SourcePosition end) {

    public SourceRange {
        Objects.requireNonNull(begin, "begin must not be null");
        if (end != null && end.isBefore(begin)) {
            throw new IllegalArgumentException("end " + end + " is before begin " + begin);
        }
    }

    public static SourceRange at(int line, int column) {
        return new SourceRange(new SourcePosition(line, column), null);
    }

    public static SourceRange of(int beginLine, int beginColumn, int endLine, int endColumn) {
        return new SourceRange(new SourcePosition(beginLine, beginColumn), new SourcePosition(endLine, endColumn));
    }

    public boolean hasEnd() {
        return end != null;
    }

    @Override
    public String toString() {
        return end == null ? begin.toString() : begin + "-" + end;
    }
}
