package jtat.core;

/// A malformed pattern or template: two variadic placeholders in one list, a variadic placeholder
/// outside a list, or a template placeholder the pattern never binds.
///
/// These are mistakes in the rule table, reported with the offending rule's name when known.
@SuppressWarnings("serial")
public final class PatternException extends RewriteException {

    private static final long serialVersionUID = 1L;

    private final String ruleName;

    public PatternException(String message) {
        this(message, null);
    }

    public PatternException(String message, String ruleName) {
        super(ruleName == null ? message : "rule '" + ruleName + "': " + message);
        this.ruleName = ruleName;
    }

    /// The name of the rule at fault, or null when raised outside a rule.
    public String ruleName() {
        return ruleName;
    }

    /// The same problem attributed to a rule; unchanged if a rule is already named.
    PatternException inRule(String name) {
        if (ruleName != null) {
            return this;
        }
        final var attributed = new PatternException(getMessage(), name);
        attributed.setStackTrace(getStackTrace());
        return attributed;
    }
}
