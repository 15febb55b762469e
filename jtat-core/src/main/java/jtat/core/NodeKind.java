package jtat.core;

import java.util.Objects;

/// The kind tag of a syntax-tree node.
///
/// `statement` marks the kinds whose start line bounds a region of original source that can be
/// replaced as a unit. Which kinds those are is decided by the parser collaborator.
///
/// @param name the kind name, e.g. `MethodCallExpr`
/// @param statement whether nodes of this kind are statement-kind
public record NodeKind(String name, boolean statement) {

    public NodeKind {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static NodeKind expression(String name) {
        return new NodeKind(name, false);
    }

    public static NodeKind statement(String name) {
        return new NodeKind(name, true);
    }

    @Override
    public String toString() {
        return name;
    }
}
