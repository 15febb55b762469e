package jtat.core;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Objects;
import java.util.logging.Logger;

/// Rewrites whole source files: parse, index, drive the rewrite, reconstruct.
///
/// Immutable and reusable across files; every call owns its own tree, index and output state.
/// Files are read and written as UTF-8.
public final class SourceRewriter {

    private static final Logger LOG = Logger.getLogger(SourceRewriter.class.getName());

    private final SyntaxParser parser;
    private final Renderer renderer;
    private final NodeRewriter rewriter;
    private final RewriteSettings settings;

    public SourceRewriter(SyntaxParser parser, Renderer renderer, NodeRewriter rewriter, RewriteSettings settings) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public SourceRewriter(SyntaxParser parser, Renderer renderer, NodeRewriter rewriter) {
        this(parser, renderer, rewriter, RewriteSettings.defaults());
    }

    public String rewrite(String source, String fileName) {
        final var out = new StringBuilder(source.length());
        rewriteTo(source, fileName, out);
        return out.toString();
    }

    /// Streams the rewritten text of `source` to `out`.
    public void rewrite(String source, String fileName, Appendable out) throws IOException {
        try {
            rewriteTo(source, fileName, out);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    public String rewriteFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        return rewrite(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    /// Rewrites `file` to standard output. A reader that goes away early is not an error.
    public void rewriteToStandardOutput(Path file) throws IOException {
        rewriteTo(file, new FileOutputStream(FileDescriptor.out));
    }

    /// Streams the rewritten file to `stream`, which is flushed but not closed.
    public void rewriteTo(Path file, OutputStream stream) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(stream, "stream must not be null");
        final var source = Files.readString(file, StandardCharsets.UTF_8);
        final var writer = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        try {
            rewrite(source, file.toString(), writer);
            writer.flush();
        } catch (IOException e) {
            if (!isBrokenPipe(e)) {
                throw e;
            }
            LOG.fine(() -> "output closed early while writing " + file);
        }
    }

    /// Replaces `file` with its rewritten text.
    ///
    /// The output is staged in a temporary file next to the target and moved over it atomically
    /// once complete. On any failure the temporary file is removed and the target is untouched.
    public void rewriteInPlace(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        final var source = Files.readString(file, StandardCharsets.UTF_8);
        final var target = file.toAbsolutePath();
        final var temp = Files.createTempFile(target.getParent(), "." + target.getFileName() + ".", ".jtat");
        try {
            try (var writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                rewrite(source, file.toString(), writer);
            }
            copyPermissions(target, temp);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp, e);
            throw e;
        }
        LOG.fine(() -> "replaced " + target);
    }

    private void rewriteTo(String source, String fileName, Appendable out) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(out, "out must not be null");
        final var syntax = parser.syntax();
        final var tree = parser.parseFile(source, fileName);
        final var text = SourceText.of(source);
        final var index = StatementIndex.build(tree);
        final var reconstructor = new SourceReconstructor(text, out, syntax, settings.separators());
        final var driver = new RewriteDriver(rewriter, renderer, syntax, index, text, reconstructor);
        driver.run(tree);
        LOG.info(() -> fileName + ": " + driver.splices() + " region(s) rewritten");
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        final var view = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        if (view != null) {
            Files.setPosixFilePermissions(to, view.readAttributes().permissions());
        }
    }

    private static void deleteQuietly(Path temp, Exception primary) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    /// The JDK has no dedicated exception for a closed pipe, so this matches the message text the
    /// platform reports: "Broken pipe" on POSIX systems, "The pipe is being closed" on Windows.
    /// Other locales or platforms may word it differently and then surface as an error.
    static boolean isBrokenPipe(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            final var message = t.getMessage();
            if (message != null && (message.contains("Broken pipe") || message.contains("pipe is being closed"))) {
                return true;
            }
        }
        return false;
    }
}
