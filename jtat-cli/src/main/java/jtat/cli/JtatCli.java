package jtat.cli;

import jtat.core.RewriteException;
import jtat.core.RewriteSettings;
import jtat.javaparser.JavaLanguage;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// CLI entry point for rewriting Java sources with a rule file.
///
/// Usage:
/// `java -jar jtat-cli.jar run [--in-place|-i] [--separators] --rules <rules-file> <target-file>...`
///
/// Without `--in-place` each rewritten file is written to standard output in turn.
/// Exit codes: 0 on success, 2 on a usage error, 1 when a file cannot be rewritten.
///
/// System properties `jtat.separators`, `jtat.java.languageLevel`, `jtat.java.indent` and
/// `jtat.renderers` are honoured; flags win over properties. `jtat.log.level` sets the log level
/// (default `WARNING`).
public final class JtatCli {

    private static final Logger LOG = Logger.getLogger(JtatCli.class.getName());

    static final String LOG_LEVEL_PROPERTY = "jtat.log.level";
    static final String USAGE = "Usage: java -jar jtat-cli.jar run [--in-place|-i] [--separators] --rules <rules-file> <target-file>...";

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE_ERROR = 2;

    private JtatCli() {}

    public static void main(String[] args) {
        configureLogging(System.getProperty(LOG_LEVEL_PROPERTY, "WARNING"));
        final var err = new PrintWriter(System.err, true, StandardCharsets.UTF_8);
        final int status = run(args, System.out, err);
        err.flush();
        if (status != OK) {
            System.exit(status);
        }
    }

    /// Runs one command line, returning the exit code.
    static int run(String[] args, OutputStream out, PrintWriter err) {
        Objects.requireNonNull(out, "out must not be null");
        Objects.requireNonNull(err, "err must not be null");
        final Options options;
        try {
            options = Options.parse(args == null ? List.of() : List.of(args));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return USAGE_ERROR;
        }
        try {
            final var java = JavaLanguage.fromSystemProperties();
            var settings = RewriteSettings.fromSystemProperties();
            if (options.separators()) {
                settings = settings.withSeparators(true);
            }
            final var rules = RuleFileParser.parse(options.rules(), java.rules());
            LOG.fine(() -> "loaded " + rules.rules().size() + " rule(s) from " + options.rules());
            final var rewriter = java.rewriter(rules, settings);
            for (final var target : options.targets()) {
                if (options.inPlace()) {
                    rewriter.rewriteInPlace(target);
                } else {
                    rewriter.rewriteTo(target, out);
                }
            }
            return OK;
        } catch (IOException e) {
            LOG.log(Level.FINE, "I/O failure", e);
            err.println("error: " + describe(e));
            return FAILED;
        } catch (RewriteException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "rewrite failure", e);
            err.println("error: " + e.getMessage());
            return FAILED;
        }
    }

    private static String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "no such file: " + e.getMessage();
        }
        return e.getMessage() == null ? e.toString() : e.getMessage();
    }

    /// One-line console output on the root logger.
    static void configureLogging(String levelName) {
        Level level;
        try {
            level = Level.parse(levelName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            level = Level.WARNING;
        }
        System.setProperty("java.util.logging.SimpleFormatter.format", "%4$s %3$s: %5$s%6$s%n");
        final var root = Logger.getLogger("");
        root.setLevel(level);
        var installed = false;
        for (final var handler : root.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setFormatter(new SimpleFormatter());
                handler.setLevel(level);
                installed = true;
            }
        }
        if (!installed) {
            final var handler = new ConsoleHandler();
            handler.setFormatter(new SimpleFormatter());
            handler.setLevel(level);
            root.addHandler(handler);
        }
    }

    record Options(boolean inPlace, boolean separators, Path rules, List<Path> targets) {

        static Options parse(List<String> args) {
            if (args.isEmpty() || !"run".equals(args.get(0))) {
                throw new IllegalArgumentException(args.isEmpty() ? "missing command" : "unknown command: " + args.get(0));
            }
            var inPlace = false;
            var separators = false;
            Path rules = null;
            final var targets = new ArrayList<Path>();
            for (int i = 1; i < args.size(); i++) {
                final var arg = args.get(i);
                switch (arg) {
                    case "--in-place", "-i" -> inPlace = true;
                    case "--separators" -> separators = true;
                    case "--rules" -> {
                        if (i + 1 >= args.size()) {
                            throw new IllegalArgumentException("--rules needs a file");
                        }
                        rules = Path.of(args.get(++i));
                    }
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("unknown option: " + arg);
                        }
                        targets.add(Path.of(arg));
                    }
                }
            }
            if (rules == null) {
                throw new IllegalArgumentException("missing --rules <rules-file>");
            }
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("missing target file");
            }
            return new Options(inPlace, separators, rules, List.copyOf(targets));
        }
    }
}
