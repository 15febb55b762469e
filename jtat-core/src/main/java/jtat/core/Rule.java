package jtat.core;

import java.util.Objects;

/// One entry of a [RuleTable].
///
/// @param name used in log lines and error messages
/// @param pattern tree to match, may contain placeholders
/// @param action applied to matching nodes
public record Rule(String name, Node pattern, Action action) {

    public Rule {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }
}
