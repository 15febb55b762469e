package jtat.core;

import java.util.List;
import java.util.Objects;

/// What one placeholder bound during a match.
public sealed interface Capture permits Capture.Single, Capture.Sequence {

    /// A simple placeholder's binding: a node, a scalar, or [FieldValue.Absent].
    record Single(FieldValue value) implements Capture {
        public Single {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// A variadic placeholder's binding: a contiguous, possibly empty run of list elements.
    record Sequence(List<Node> nodes) implements Capture {
        public Sequence {
            Objects.requireNonNull(nodes, "nodes must not be null");
            nodes = List.copyOf(nodes);
        }
    }
}
