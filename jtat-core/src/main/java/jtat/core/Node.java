package jtat.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A syntax-tree node: a kind, an ordered mapping of field name to [FieldValue], and the source
/// range it was parsed from (null for nodes built by substitution or by hand).
///
/// Nodes are immutable. Equality is structural over `kind` and `fields`; the source range does not
/// take part, so a node rebuilt from a template equals the parsed node it mirrors. Code that needs
/// to know whether a node was replaced compares identities.
public record Node(NodeKind kind, Map<String, FieldValue> fields, SourceRange range) {

    public Node {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        final var copy = new LinkedHashMap<String, FieldValue>(fields.size());
        for (final var entry : fields.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "field name must not be null");
            Objects.requireNonNull(entry.getValue(), () -> "value of field '" + entry.getKey() + "' must not be null");
            copy.put(entry.getKey(), entry.getValue());
        }
        fields = Collections.unmodifiableMap(copy);
    }

    public static Node of(NodeKind kind, Map<String, FieldValue> fields) {
        return new Node(kind, fields, null);
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /// The value of a field; [FieldValue.Absent] when the node has no such field.
    public FieldValue field(String name) {
        return fields.getOrDefault(name, FieldValue.Absent.INSTANCE);
    }

    public Node withField(String name, FieldValue value) {
        final var updated = new LinkedHashMap<>(fields);
        updated.put(name, value);
        return new Node(kind, updated, range);
    }

    public Node withFields(Map<String, FieldValue> replacement) {
        return new Node(kind, replacement, range);
    }

    public Node withRange(SourceRange newRange) {
        return new Node(kind, fields, newRange);
    }

    public boolean isStatement() {
        return kind.statement();
    }

    /// Start line, or 0 when the node carries no position.
    public int line() {
        return range == null ? 0 : range.begin().line();
    }

    /// A deep copy with fresh identities throughout; source ranges are kept.
    public Node copy() {
        final var copied = new LinkedHashMap<String, FieldValue>(fields.size());
        fields.forEach((name, value) -> copied.put(name, value.copy()));
        return new Node(kind, copied, range);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node other)) return false;
        return kind.equals(other.kind) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + fields.hashCode();
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder(kind.name()).append('(');
        var first = true;
        for (final var entry : fields.entrySet()) {
            if (entry.getValue() == FieldValue.Absent.INSTANCE) continue;
            if (!first) sb.append(", ");
            first = false;
            sb.append(entry.getKey()).append('=');
            final var value = entry.getValue();
            if (value instanceof FieldValue.NodeValue nv) {
                sb.append(nv.node());
            } else if (value instanceof FieldValue.ListValue lv) {
                sb.append(lv.nodes());
            } else {
                sb.append(value);
            }
        }
        return sb.append(')').toString();
    }

    /// Fluent construction of nodes, mostly for patterns and tests built without a parser.
    public static final class Builder {
        private final NodeKind kind;
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();
        private SourceRange range;

        private Builder(NodeKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder node(String name, Node value) {
            fields.put(name, FieldValue.of(value));
            return this;
        }

        public Builder list(String name, List<Node> values) {
            fields.put(name, FieldValue.of(values));
            return this;
        }

        public Builder list(String name, Node... values) {
            return list(name, List.of(values));
        }

        public Builder scalar(String name, Object value) {
            fields.put(name, FieldValue.scalar(value));
            return this;
        }

        public Builder absent(String name) {
            fields.put(name, FieldValue.Absent.INSTANCE);
            return this;
        }

        public Builder at(int line, int column) {
            this.range = SourceRange.at(line, column);
            return this;
        }

        public Builder range(SourceRange value) {
            this.range = value;
            return this;
        }

        public Node build() {
            return new Node(kind, fields, range);
        }
    }
}
