package jtat.core;

import java.util.Objects;

/// Decides, node by node, what the rewrite driver does with a tree.
///
/// The driver offers every node in pre-order; nodes that come back [Rewrite.Replaced] or
/// [Rewrite.Deleted] are not descended into.
@FunctionalInterface
public interface NodeRewriter {

    Rewrite rewrite(Node node);

    /// Offers nodes this rewriter leaves unchanged to `next`.
    default NodeRewriter orElse(NodeRewriter next) {
        Objects.requireNonNull(next, "next must not be null");
        return node -> {
            final var first = rewrite(node);
            return first instanceof Rewrite.Unchanged ? next.rewrite(node) : first;
        };
    }
}
