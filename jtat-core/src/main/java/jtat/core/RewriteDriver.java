package jtat.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.logging.Logger;

/// Walks one file's tree, applies the [NodeRewriter], and streams the output through a
/// [SourceReconstructor].
///
/// Every open statement has a mode. It starts `NORMAL` and flips to `REPLACE` when anything
/// below it is rewritten; closing a `REPLACE` statement re-renders it over its original lines.
/// A statement that was itself replaced or deleted is spliced directly. Splices are held until
/// the outermost open statement closes, because an enclosing statement that is re-rendered later
/// covers them, and are then written in source order.
///
/// One instance per file; not reusable.
final class RewriteDriver {

    private static final Logger LOG = Logger.getLogger(RewriteDriver.class.getName());

    enum Mode { NORMAL, REPLACE }

    private final NodeRewriter rewriter;
    private final Renderer renderer;
    private final TreeSyntax syntax;
    private final StatementIndex index;
    private final SourceText source;
    private final SourceReconstructor out;

    private final Deque<Frame> open = new ArrayDeque<>();
    private SourcePosition cursor = SourcePosition.START;
    private int splices;

    RewriteDriver(NodeRewriter rewriter, Renderer renderer, TreeSyntax syntax, StatementIndex index,
                  SourceText source, SourceReconstructor out) {
        this.rewriter = rewriter;
        this.renderer = renderer;
        this.syntax = syntax;
        this.index = index;
        this.source = source;
        this.out = out;
    }

    /// Rewrites the whole file and returns the rewritten tree, or null if the root was deleted.
    Node run(Node root) {
        final var result = visit(root, false);
        out.flushToEnd(cursor);
        return result;
    }

    /// Number of regions of the original text that were replaced.
    int splices() {
        return splices;
    }

    /// @param listElement whether `node` is an element of a list field, where it can be dropped
    private Node visit(Node node, boolean listElement) {
        final var rewrite = rewriter.rewrite(node);
        if (rewrite instanceof Rewrite.Replaced replaced && replaced.node() != node) {
            final var replacement = replaced.node().withRange(node.range());
            rewritten(node, replacement);
            return replacement;
        }
        if (rewrite instanceof Rewrite.Deleted) {
            if (listElement || !node.isStatement()) {
                rewritten(node, null);
                return null;
            }
            // a statement filling a single slot, e.g. an unbraced loop body
            final var empty = syntax.emptyStatement();
            if (empty.isPresent()) {
                final var replacement = empty.get().withRange(node.range());
                rewritten(node, replacement);
                return replacement;
            }
            markEnclosing(node);
            return null;
        }
        if (!node.isStatement()) {
            return visitChildren(node);
        }
        final var frame = new Frame(node);
        open.push(frame);
        final var rebuilt = visitChildren(node);
        open.pop();
        if (frame.mode == Mode.REPLACE) {
            if (!frame.pending.isEmpty()) {
                LOG.fine(() -> frame.pending.size() + " nested splice(s) covered by " + node.kind() + " at line " + node.line());
            }
            rewritten(node, rebuilt);
        } else {
            frame.pending.forEach(this::deliver);
        }
        return rebuilt;
    }

    private Node visitChildren(Node node) {
        LinkedHashMap<String, FieldValue> changed = null;
        for (final var entry : node.fields().entrySet()) {
            final var value = entry.getValue();
            FieldValue updated = value;
            if (value instanceof FieldValue.NodeValue nv) {
                final var child = visit(nv.node(), false);
                if (child != nv.node()) {
                    updated = FieldValue.of(child);
                }
            } else if (value instanceof FieldValue.ListValue lv) {
                List<Node> elements = null;
                for (int i = 0; i < lv.nodes().size(); i++) {
                    final var element = lv.nodes().get(i);
                    final var child = visit(element, true);
                    if (child != element && elements == null) {
                        elements = new ArrayList<>(lv.nodes().subList(0, i));
                    }
                    if (elements != null && child != null) {
                        elements.add(child);
                    }
                }
                if (elements != null) {
                    updated = FieldValue.of(elements);
                }
            }
            if (updated != value) {
                if (changed == null) {
                    changed = new LinkedHashMap<>(node.fields());
                }
                changed.put(entry.getKey(), updated);
            }
        }
        return changed == null ? node : node.withFields(changed);
    }

    /// A node was replaced or deleted (replacement null). Statements with a position are
    /// spliced; anything else marks the enclosing statement for re-rendering.
    private void rewritten(Node original, Node replacement) {
        if (original.isStatement() && original.range() != null) {
            deliver(splice(original, replacement));
            return;
        }
        markEnclosing(original);
    }

    private void markEnclosing(Node original) {
        final var enclosing = open.peek();
        if (enclosing == null) {
            throw new RewriteException("rewrite of " + original.kind() + " at " + original.range()
                    + " is not enclosed by any statement");
        }
        enclosing.mode = Mode.REPLACE;
    }

    private void deliver(Splice splice) {
        final var enclosing = open.peek();
        if (enclosing != null) {
            enclosing.pending.add(splice);
        } else {
            emit(splice);
        }
    }

    private Splice splice(Node original, Node replacement) {
        final var range = original.range();
        final var begin = range.begin();
        final var endLine = Math.max(begin.line(), index.statementEnd(original, source, syntax));
        final SourcePosition resume;
        if (range.hasEnd() && range.end().line() == endLine) {
            resume = new SourcePosition(endLine, range.end().column() + 1);
        } else {
            resume = new SourcePosition(endLine, source.line(endLine).length() + 1);
        }
        if (replacement != null) {
            return new Splice(begin, resume, replacement, source.indentation(begin.line()), begin.line(), endLine);
        }
        final var before = source.line(begin.line()).substring(0, Math.min(begin.column() - 1, source.line(begin.line()).length()));
        final var endText = source.line(endLine);
        final var after = endText.substring(Math.min(resume.column() - 1, endText.length()));
        if (before.isBlank() && after.isBlank()) {
            // the statement owns its lines: take them out whole
            return new Splice(new SourcePosition(begin.line(), 1), resume.nextLine(), null, "", begin.line(), endLine);
        }
        return new Splice(begin, resume, null, "", begin.line(), endLine);
    }

    private void emit(Splice splice) {
        if (splice.from().isBefore(cursor)) {
            LOG.warning(() -> "splice at " + splice.from() + " overlaps text already written up to " + cursor);
        } else {
            out.flush(cursor, splice.from());
        }
        final var rendered = splice.replacement() == null ? "" : renderer.render(splice.replacement()).strip();
        out.splice(rendered, splice.indent(), splice.fromLine(), splice.toLine());
        if (cursor.isBefore(splice.resume())) {
            cursor = splice.resume();
        }
        splices++;
    }

    private static final class Frame {
        private final Node statement;
        private final List<Splice> pending = new ArrayList<>();
        private Mode mode = Mode.NORMAL;

        private Frame(Node statement) {
            this.statement = statement;
        }

        @Override
        public String toString() {
            return statement.kind() + "@" + statement.line() + "[" + mode + "]";
        }
    }

    private record Splice(SourcePosition from, SourcePosition resume, Node replacement, String indent,
                          int fromLine, int toLine) {}
}
