package jtat.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The value held by one field of a [Node].
///
/// A closed union: a nested node, a list of nodes, a primitive scalar, or nothing.
/// Scalars compare by value, nodes and lists structurally.
public sealed interface FieldValue permits FieldValue.NodeValue, FieldValue.ListValue, FieldValue.Scalar, FieldValue.Absent {

    /// A deep copy; nested nodes get fresh identities.
    FieldValue copy();

    static FieldValue of(Node node) {
        return node == null ? Absent.INSTANCE : new NodeValue(node);
    }

    static FieldValue of(List<Node> nodes) {
        return new ListValue(nodes);
    }

    static FieldValue scalar(Object value) {
        return value == null ? Absent.INSTANCE : new Scalar(value);
    }

    record NodeValue(Node node) implements FieldValue {
        public NodeValue {
            Objects.requireNonNull(node, "node must not be null");
        }

        @Override
        public FieldValue copy() {
            return new NodeValue(node.copy());
        }
    }

    record ListValue(List<Node> nodes) implements FieldValue {
        public ListValue {
            Objects.requireNonNull(nodes, "nodes must not be null");
            nodes = List.copyOf(nodes);
        }

        @Override
        public FieldValue copy() {
            final var copies = new ArrayList<Node>(nodes.size());
            for (final var node : nodes) {
                copies.add(node.copy());
            }
            return new ListValue(copies);
        }
    }

    /// An identifier, literal text, number, boolean or enum constant.
    record Scalar(Object value) implements FieldValue {
        public Scalar {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public FieldValue copy() {
            return this;
        }

        @Override
        public String toString() {
            return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
        }
    }

    enum Absent implements FieldValue {
        INSTANCE;

        @Override
        public FieldValue copy() {
            return this;
        }
    }
}
