package jtat.cli;

import jtat.core.PatternException;
import jtat.core.RuleTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads rule files: one rule per line.
///
/// ```
/// # comments and blank lines are skipped
/// print(__1) => print(__1, System.out)
/// debug(__1); => @delete
/// synchronized (_1) { __2; } => { __2; }
/// ```
///
/// A pattern ending with `;` or `}` is parsed as a statement, anything else as an expression.
/// Each rule is named `<file>:<line>` so errors point back at the rule file.
final class RuleFileParser {

    private static final Logger LOG = Logger.getLogger(RuleFileParser.class.getName());

    static final String ARROW = "=>";
    static final String DELETE = "@delete";

    private RuleFileParser() {}

    static RuleTable parse(Path file, RuleTable.Builder rules) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString(), rules);
    }

    static RuleTable parse(String text, String fileName, RuleTable.Builder rules) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        final var lines = text.split("\r\n|\r|\n", -1);
        var count = 0;
        for (int i = 0; i < lines.length; i++) {
            final var line = lines[i].strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            addRule(rules, fileName + ":" + (i + 1), line);
            count++;
        }
        final var total = count;
        LOG.fine(() -> fileName + ": " + total + " rule(s)");
        return rules.build();
    }

    private static void addRule(RuleTable.Builder rules, String name, String line) {
        final var arrow = line.indexOf(ARROW);
        if (arrow < 0) {
            throw new PatternException("expected 'pattern => template', got: " + line, name);
        }
        final var pattern = line.substring(0, arrow).strip();
        final var template = line.substring(arrow + ARROW.length()).strip();
        if (pattern.isEmpty()) {
            throw new PatternException("missing pattern before '" + ARROW + "'", name);
        }
        if (template.isEmpty()) {
            throw new PatternException("missing template after '" + ARROW + "', use " + DELETE + " to delete", name);
        }
        final var statement = pattern.endsWith(";") || pattern.endsWith("}");
        if (DELETE.equals(template)) {
            if (statement) {
                rules.deleteStatement(name, pattern);
            } else {
                rules.deleteExpression(name, pattern);
            }
        } else if (statement) {
            rules.statement(name, pattern, template);
        } else {
            rules.expression(name, pattern, template);
        }
    }
}
