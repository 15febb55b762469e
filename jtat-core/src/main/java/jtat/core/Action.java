package jtat.core;

import java.util.Objects;
import java.util.function.Function;

/// What a [Rule] does with a node its pattern matched.
public sealed interface Action permits Action.Template, Action.Transform, Action.Delete {

    /// Replace the node with the template, placeholders substituted.
    record Template(Node template) implements Action {
        public Template {
            Objects.requireNonNull(template, "template must not be null");
        }
    }

    /// Replace the node with whatever the function builds from the captures.
    record Transform(Function<Captures, Node> function) implements Action {
        public Transform {
            Objects.requireNonNull(function, "function must not be null");
        }
    }

    /// Remove the node.
    enum Delete implements Action {
        INSTANCE
    }
}
