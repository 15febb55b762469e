package jtat.core;

import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Line facts computed once per file, before any rewriting.
///
/// For every positioned node, `last_line` is the furthest line the node or anything below it
/// reaches. The statement lines are the sorted, distinct lines on which a statement-kind node
/// begins, plus the lines on which one ends when the parser reports end positions. Together they
/// let the driver find where the text of a rewritten statement stops.
public final class StatementIndex {

    private static final Logger LOG = Logger.getLogger(StatementIndex.class.getName());

    private final Map<Node, Integer> lastLines;
    private final int[] statementLines;

    private StatementIndex(Map<Node, Integer> lastLines, int[] statementLines) {
        this.lastLines = lastLines;
        this.statementLines = statementLines;
    }

    public static StatementIndex build(Node root) {
        Objects.requireNonNull(root, "root must not be null");
        final var lastLines = new IdentityHashMap<Node, Integer>();
        final var lines = new TreeSet<Integer>();
        index(root, lastLines, lines);
        final var sorted = lines.stream().mapToInt(Integer::intValue).toArray();
        LOG.finer(() -> "indexed " + lastLines.size() + " nodes, " + sorted.length + " statement lines");
        return new StatementIndex(lastLines, sorted);
    }

    private static int index(Node node, Map<Node, Integer> lastLines, TreeSet<Integer> lines) {
        var last = node.line();
        final var range = node.range();
        if (range != null && range.hasEnd()) {
            last = Math.max(last, range.end().line());
        }
        for (final var value : node.fields().values()) {
            if (value instanceof FieldValue.NodeValue nv) {
                last = Math.max(last, index(nv.node(), lastLines, lines));
            } else if (value instanceof FieldValue.ListValue lv) {
                for (final var child : lv.nodes()) {
                    last = Math.max(last, index(child, lastLines, lines));
                }
            }
        }
        if (node.isStatement() && range != null) {
            lines.add(range.begin().line());
            if (range.hasEnd()) {
                lines.add(range.end().line());
            }
        }
        if (last > 0) {
            lastLines.put(node, last);
        }
        return last;
    }

    /// The furthest line the node reaches, 0 for nodes without any position in this tree.
    public int lastLine(Node node) {
        final var last = lastLines.get(node);
        return last == null ? node.line() : last;
    }

    public List<Integer> statementLines() {
        return Arrays.stream(statementLines).boxed().toList();
    }

    /// The smallest statement line strictly greater than `line`.
    public OptionalInt nextBoundaryAfter(int line) {
        var low = 0;
        var high = statementLines.length;
        while (low < high) {
            final var mid = (low + high) >>> 1;
            if (statementLines[mid] <= line) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low < statementLines.length ? OptionalInt.of(statementLines[low]) : OptionalInt.empty();
    }

    /// The last line of original text belonging to a statement.
    ///
    /// Lines between the statement's `last_line` and the next statement line belong to it
    /// unless they are blank or comment-only; trailing blank and comment lines stay with what
    /// follows. With no later statement line, `last_line` is taken as the end.
    public int statementEnd(Node statement, SourceText source, TreeSyntax syntax) {
        final var last = lastLine(statement);
        final var next = nextBoundaryAfter(last);
        if (next.isEmpty()) {
            LOG.fine(() -> "no statement line after " + last + ", taking it as the end of " + statement.kind());
            return last;
        }
        for (int line = next.getAsInt() - 1; line > last; line--) {
            if (!syntax.isBlankOrComment(source.line(line))) {
                return line;
            }
        }
        return last;
    }
}
