package jtat.core;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Structural matching of a pattern tree, which may contain placeholders, against a tree from
/// the file being rewritten.
///
/// Matching is total and deterministic: it either returns the captures or empty, and never
/// backtracks. The only exception it raises is [PatternException] for a pattern list holding
/// two variadic placeholders, which rule construction normally rejects first.
public final class PatternMatcher {

    private static final Logger LOG = Logger.getLogger(PatternMatcher.class.getName());

    private final TreeSyntax syntax;

    public PatternMatcher(TreeSyntax syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
    }

    public Optional<Captures> match(Node expected, Node test) {
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(test, "test must not be null");
        final var bindings = new LinkedHashMap<String, Capture>();
        if (!matchNode(expected, test, bindings)) {
            return Optional.empty();
        }
        LOG.finer(() -> "matched " + expected.kind() + " at " + test.range() + " binding " + bindings.keySet());
        return Optional.of(new Captures(bindings));
    }

    private boolean matchNode(Node expected, Node test, Map<String, Capture> bindings) {
        final var placeholder = Placeholders.simpleName(syntax, expected);
        if (placeholder != null) {
            return bind(placeholder, new Capture.Single(FieldValue.of(test)), bindings);
        }
        if (!expected.kind().equals(test.kind())) {
            return false;
        }
        String skip = null;
        final var attribute = Placeholders.attributeName(syntax, expected);
        if (attribute != null) {
            skip = syntax.attributeFields(expected.kind()).orElseThrow().attribute();
            final var captured = test.field(skip);
            if (!(captured instanceof FieldValue.Scalar) || !bind(attribute, new Capture.Single(captured), bindings)) {
                return false;
            }
        }
        final var names = new LinkedHashSet<>(expected.fields().keySet());
        names.addAll(test.fields().keySet());
        for (final var name : names) {
            if (name.equals(skip)) {
                continue;
            }
            if (!matchField(expected.field(name), test.field(name), bindings)) {
                return false;
            }
        }
        return true;
    }

    private boolean matchField(FieldValue expected, FieldValue test, Map<String, Capture> bindings) {
        if (expected instanceof FieldValue.NodeValue nv) {
            final var placeholder = Placeholders.simpleName(syntax, nv.node());
            if (placeholder != null) {
                return bind(placeholder, new Capture.Single(test), bindings);
            }
            return test instanceof FieldValue.NodeValue tv && matchNode(nv.node(), tv.node(), bindings);
        }
        if (expected instanceof FieldValue.ListValue lv) {
            return test instanceof FieldValue.ListValue tv && matchList(lv.nodes(), tv.nodes(), bindings);
        }
        return expected.equals(test);
    }

    private boolean matchList(List<Node> expected, List<Node> test, Map<String, Capture> bindings) {
        final var variadic = Placeholders.variadicIndex(syntax, expected);
        if (variadic < 0) {
            if (expected.size() != test.size()) {
                return false;
            }
            for (int i = 0; i < expected.size(); i++) {
                if (!matchNode(expected.get(i), test.get(i), bindings)) {
                    return false;
                }
            }
            return true;
        }
        final var fixed = expected.size() - 1;
        final var runLength = test.size() - fixed;
        if (runLength < 0) {
            return false;
        }
        for (int i = 0; i < variadic; i++) {
            if (!matchNode(expected.get(i), test.get(i), bindings)) {
                return false;
            }
        }
        for (int i = variadic + 1; i < expected.size(); i++) {
            if (!matchNode(expected.get(i), test.get(i + runLength - 1), bindings)) {
                return false;
            }
        }
        final var name = Placeholders.variadicName(syntax, expected.get(variadic));
        return bind(name, new Capture.Sequence(test.subList(variadic, variadic + runLength)), bindings);
    }

    private static boolean bind(String name, Capture capture, Map<String, Capture> bindings) {
        final var previous = bindings.putIfAbsent(name, capture);
        return previous == null || previous.equals(capture);
    }
}
