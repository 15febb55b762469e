package jtat.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Visitor-style rewriting: one hook per node kind name.
///
/// Kinds without a hook are left unchanged, and the driver carries on into their children.
public final class KindRewriter implements NodeRewriter {

    private final Map<String, Function<Node, Rewrite>> hooks;

    private KindRewriter(Map<String, Function<Node, Rewrite>> hooks) {
        this.hooks = Map.copyOf(hooks);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Rewrite rewrite(Node node) {
        final var hook = hooks.get(node.kind().name());
        if (hook == null) {
            return Rewrite.unchanged();
        }
        final var result = hook.apply(node);
        if (result == null) {
            throw new RewriteException("hook for " + node.kind() + " returned null");
        }
        return result;
    }

    public static final class Builder {
        private final Map<String, Function<Node, Rewrite>> hooks = new LinkedHashMap<>();

        private Builder() {}

        public Builder on(String kindName, Function<Node, Rewrite> hook) {
            Objects.requireNonNull(kindName, "kindName must not be null");
            Objects.requireNonNull(hook, "hook must not be null");
            if (hooks.putIfAbsent(kindName, hook) != null) {
                throw new IllegalArgumentException("a hook for " + kindName + " is already registered");
            }
            return this;
        }

        public KindRewriter build() {
            return new KindRewriter(hooks);
        }
    }
}
