package jtat.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// The bindings of one successful match, keyed by placeholder name.
///
/// Immutable. A [Action.Transform] receives one of these and reads its captures through the typed
/// accessors, which fail with [PatternException] when a placeholder is unbound or bound to
/// something of another shape.
public final class Captures {

    private final Map<String, Capture> bindings;

    Captures(Map<String, Capture> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Optional<Capture> get(String name) {
        return Optional.ofNullable(bindings.get(Objects.requireNonNull(name, "name must not be null")));
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /// The node a simple placeholder captured.
    public Node node(String name) {
        if (require(name) instanceof Capture.Single single && single.value() instanceof FieldValue.NodeValue nv) {
            return nv.node();
        }
        throw new PatternException("placeholder " + name + " did not capture a node: " + bindings.get(name));
    }

    /// The run a variadic placeholder captured.
    public List<Node> nodes(String name) {
        if (require(name) instanceof Capture.Sequence sequence) {
            return sequence.nodes();
        }
        throw new PatternException("placeholder " + name + " did not capture a sequence: " + bindings.get(name));
    }

    /// The scalar a simple placeholder captured, e.g. an attribute name.
    public Object scalar(String name) {
        if (require(name) instanceof Capture.Single single && single.value() instanceof FieldValue.Scalar scalar) {
            return scalar.value();
        }
        throw new PatternException("placeholder " + name + " did not capture a scalar: " + bindings.get(name));
    }

    public Set<String> names() {
        return bindings.keySet();
    }

    public int size() {
        return bindings.size();
    }

    private Capture require(String name) {
        final var capture = bindings.get(Objects.requireNonNull(name, "name must not be null"));
        if (capture == null) {
            throw new PatternException("placeholder " + name + " is not bound");
        }
        return capture;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Captures other && bindings.equals(other.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Captures" + bindings;
    }
}
