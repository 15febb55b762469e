package jtat.core;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.logging.Logger;

/// Writes the output file: original text copied verbatim, rewritten statements spliced in.
///
/// The sink is written forward only. I/O failures surface as [UncheckedIOException]; the file
/// level entry points in [SourceRewriter] unwrap them.
///
/// With separators on, every copied region and every splice is bracketed by marker comment
/// lines (`//=# dump from line 3` and so on, in the language's own comment syntax).
public final class SourceReconstructor {

    private static final Logger LOG = Logger.getLogger(SourceReconstructor.class.getName());

    private final SourceText source;
    private final Appendable sink;
    private final TreeSyntax syntax;
    private final boolean separators;
    private boolean atLineStart = true;

    public SourceReconstructor(SourceText source, Appendable sink, TreeSyntax syntax, boolean separators) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
        this.separators = separators;
    }

    /// Copies whole original lines `[fromLine, toLineExclusive)`.
    public void flush(int fromLine, int toLineExclusive) {
        flush(new SourcePosition(fromLine, 1), new SourcePosition(toLineExclusive, 1));
    }

    /// Copies the original text between two positions.
    public void flush(SourcePosition from, SourcePosition toExclusive) {
        final var text = source.slice(from, toExclusive);
        if (text.isEmpty()) {
            return;
        }
        LOG.finer(() -> "copy " + from + " to " + toExclusive);
        marker("dump from line " + from.line());
        write(text);
        marker("to line " + (toExclusive.column() == 1 ? toExclusive.line() - 1 : toExclusive.line()));
    }

    /// Writes rendered text in place of original lines `fromLine..toLine`.
    ///
    /// The first rendered line goes where the cursor is; every later non-empty line is prefixed
    /// with `indent`. Lines are joined with the file's own line separator.
    public void splice(String rendered, String indent, int fromLine, int toLine) {
        Objects.requireNonNull(rendered, "rendered must not be null");
        Objects.requireNonNull(indent, "indent must not be null");
        LOG.fine(() -> "splice over lines " + fromLine + "-" + toLine);
        marker("generated code from line " + fromLine);
        final var lines = rendered.split("\\R", -1);
        final var out = new StringBuilder(rendered.length() + lines.length * indent.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append(source.lineSeparator());
                if (!lines[i].isEmpty()) {
                    out.append(indent);
                }
            }
            out.append(lines[i]);
        }
        write(out);
        marker("end generated code to line " + toLine);
    }

    /// Copies everything from `from` to the end of the original text.
    public void flushToEnd(SourcePosition from) {
        marker("dump after line " + from.line());
        final var text = source.slice(source.offset(from), source.text().length());
        write(text);
        marker("to the end");
    }

    private void marker(String text) {
        if (!separators) {
            return;
        }
        if (!atLineStart) {
            write(source.lineSeparator());
        }
        write(syntax.commentLine("=# " + text) + source.lineSeparator());
    }

    private void write(CharSequence text) {
        if (text.length() == 0) {
            return;
        }
        try {
            sink.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        final var last = text.charAt(text.length() - 1);
        atLineStart = last == '\n' || last == '\r';
    }
}
