package jtat.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/// Rebuilds a template tree, replacing its placeholders with what a match captured.
///
/// The template and the captures are left untouched. Template nodes come out without a source
/// range; captured subtrees are deep-copied into place and keep theirs.
public final class Substitutor {

    private final TreeSyntax syntax;

    public Substitutor(TreeSyntax syntax) {
        this.syntax = Objects.requireNonNull(syntax, "syntax must not be null");
    }

    /// @throws PatternException if the template uses a placeholder `captures` does not bind, or
    ///         puts a variadic placeholder anywhere but in a list
    public Node substitute(Node template, Captures captures) {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(captures, "captures must not be null");
        final var variadic = Placeholders.variadicName(syntax, template);
        if (variadic != null) {
            throw new PatternException("variadic placeholder " + variadic + " can only be used inside a list");
        }
        final var placeholder = Placeholders.simpleName(syntax, template);
        if (placeholder == null) {
            return build(template, captures);
        }
        final var value = single(placeholder, captures);
        if (value instanceof FieldValue.NodeValue nv) {
            return syntax.adaptCapture(template, nv.node().copy());
        }
        if (value instanceof FieldValue.Scalar scalar) {
            return syntax.identifier(String.valueOf(scalar.value()));
        }
        throw new PatternException("placeholder " + placeholder + " captured nothing and cannot stand for a whole tree");
    }

    private Node build(Node node, Captures captures) {
        String attributeField = null;
        FieldValue attributeValue = null;
        final var attribute = Placeholders.attributeName(syntax, node);
        if (attribute != null) {
            attributeField = syntax.attributeFields(node.kind()).orElseThrow().attribute();
            attributeValue = attributeScalar(attribute, captures);
        }
        final var fields = new LinkedHashMap<String, FieldValue>(node.fields().size());
        for (final var entry : node.fields().entrySet()) {
            final var name = entry.getKey();
            if (name.equals(attributeField)) {
                fields.put(name, attributeValue);
            } else {
                fields.put(name, substituteField(entry.getValue(), captures));
            }
        }
        return Node.of(node.kind(), fields);
    }

    private FieldValue substituteField(FieldValue value, Captures captures) {
        if (value instanceof FieldValue.NodeValue nv) {
            final var child = nv.node();
            final var variadic = Placeholders.variadicName(syntax, child);
            if (variadic != null) {
                throw new PatternException("variadic placeholder " + variadic + " can only be used inside a list");
            }
            final var placeholder = Placeholders.simpleName(syntax, child);
            if (placeholder == null) {
                return FieldValue.of(build(child, captures));
            }
            final var captured = single(placeholder, captures);
            if (captured instanceof FieldValue.NodeValue capturedNode) {
                return FieldValue.of(syntax.adaptCapture(child, capturedNode.node().copy()));
            }
            return captured;
        }
        if (value instanceof FieldValue.ListValue lv) {
            return FieldValue.of(substituteList(lv.nodes(), captures));
        }
        return value;
    }

    private List<Node> substituteList(List<Node> elements, Captures captures) {
        Placeholders.variadicIndex(syntax, elements);
        final var result = new ArrayList<Node>(elements.size());
        for (final var element : elements) {
            final var variadic = Placeholders.variadicName(syntax, element);
            if (variadic != null) {
                final var run = captures.get(variadic)
                        .orElseThrow(() -> unbound(variadic));
                if (!(run instanceof Capture.Sequence sequence)) {
                    throw new PatternException("placeholder " + variadic + " did not capture a sequence");
                }
                for (final var captured : sequence.nodes()) {
                    result.add(captured.copy());
                }
                continue;
            }
            final var placeholder = Placeholders.simpleName(syntax, element);
            if (placeholder == null) {
                result.add(build(element, captures));
                continue;
            }
            final var captured = single(placeholder, captures);
            if (captured instanceof FieldValue.NodeValue nv) {
                result.add(syntax.adaptCapture(element, nv.node().copy()));
            } else if (captured instanceof FieldValue.Scalar scalar) {
                result.add(syntax.identifier(String.valueOf(scalar.value())));
            }
            // an absent capture drops the element
        }
        return result;
    }

    private FieldValue attributeScalar(String placeholder, Captures captures) {
        final var captured = single(placeholder, captures);
        if (captured instanceof FieldValue.Scalar) {
            return captured;
        }
        if (captured instanceof FieldValue.NodeValue nv) {
            final var id = syntax.identifierOf(nv.node());
            if (id != null) {
                return FieldValue.scalar(id);
            }
        }
        throw new PatternException("placeholder " + placeholder + " is used as an attribute name but captured " + captured);
    }

    private FieldValue single(String placeholder, Captures captures) {
        final var capture = captures.get(placeholder).orElseThrow(() -> unbound(placeholder));
        if (capture instanceof Capture.Single single) {
            return single.value();
        }
        throw new PatternException("placeholder " + placeholder + " captured a sequence but is used as a single value");
    }

    private static PatternException unbound(String placeholder) {
        return new PatternException("placeholder " + placeholder + " is not bound by the pattern");
    }
}
