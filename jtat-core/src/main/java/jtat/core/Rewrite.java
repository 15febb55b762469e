package jtat.core;

import java.util.Objects;

/// The outcome of offering a node to a [NodeRewriter].
public sealed interface Rewrite permits Rewrite.Unchanged, Rewrite.Replaced, Rewrite.Deleted {

    static Rewrite unchanged() {
        return Unchanged.INSTANCE;
    }

    static Rewrite replaced(Node node) {
        return new Replaced(node);
    }

    static Rewrite deleted() {
        return Deleted.INSTANCE;
    }

    enum Unchanged implements Rewrite {
        INSTANCE
    }

    record Replaced(Node node) implements Rewrite {
        public Replaced {
            Objects.requireNonNull(node, "node must not be null");
        }
    }

    enum Deleted implements Rewrite {
        INSTANCE
    }
}
