package jtat.core;

import java.util.Arrays;
import java.util.Objects;

/// The original text of one file with its line-offset table.
///
/// Lines are 1-based and end with `\n`, `\r\n` or `\r`. A final line without a terminator is
/// still a line; the empty remainder after a final terminator is not.
public final class SourceText {

    private final String text;
    private final int[] lineStarts;
    private final String lineSeparator;

    private SourceText(String text) {
        this.text = text;
        var starts = new int[64];
        var count = 0;
        String separator = null;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            final var c = text.charAt(i);
            if (c != '\n' && c != '\r') {
                continue;
            }
            if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                if (separator == null) separator = "\r\n";
                i++;
            } else if (separator == null) {
                separator = String.valueOf(c);
            }
            if (count == starts.length) {
                starts = Arrays.copyOf(starts, count * 2);
            }
            starts[count++] = i + 1;
        }
        // a terminator on the last line does not open another one
        if (count > 1 && starts[count - 1] == text.length()) {
            count--;
        }
        this.lineStarts = Arrays.copyOf(starts, count);
        this.lineSeparator = separator == null ? "\n" : separator;
    }

    public static SourceText of(String text) {
        return new SourceText(Objects.requireNonNull(text, "text must not be null"));
    }

    public String text() {
        return text;
    }

    /// The first line separator found in the text, `\n` if there is none.
    public String lineSeparator() {
        return lineSeparator;
    }

    public int lineCount() {
        return text.isEmpty() ? 0 : lineStarts.length;
    }

    /// Offset of a position; lines past the end map to the end of the text, columns are clamped
    /// to the line including its terminator.
    public int offset(SourcePosition position) {
        final var line = position.line();
        if (line > lineCount()) {
            return text.length();
        }
        final var start = lineStarts[line - 1];
        return Math.min(start + position.column() - 1, lineEnd(line));
    }

    /// Offset just past the line's terminator.
    public int lineEnd(int line) {
        return line < lineStarts.length ? lineStarts[line] : text.length();
    }

    /// The text of a line without its terminator; empty for lines outside the text.
    public String line(int line) {
        if (line < 1 || line > lineCount()) {
            return "";
        }
        var end = lineEnd(line);
        final var start = lineStarts[line - 1];
        while (end > start && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(start, end);
    }

    /// The leading spaces and tabs of a line.
    public String indentation(int line) {
        final var content = line(line);
        var i = 0;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) {
            i++;
        }
        return content.substring(0, i);
    }

    /// Whether the line ends with a terminator.
    public boolean isTerminated(int line) {
        if (line < 1 || line > lineCount()) {
            return false;
        }
        final var last = text.charAt(lineEnd(line) - 1);
        return last == '\n' || last == '\r';
    }

    public String slice(int from, int to) {
        return text.substring(from, Math.max(from, to));
    }

    public String slice(SourcePosition from, SourcePosition toExclusive) {
        return slice(offset(from), offset(toExclusive));
    }
}
