package jtat.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/// An ordered list of [Rule]s; the first rule whose pattern matches a node decides its fate.
///
/// Rules are validated when the table is built: no list in a pattern or template may hold two
/// variadic placeholders, variadic placeholders may only appear in lists, and a template may only
/// use placeholders its pattern binds. Nodes no rule matches are left unchanged.
public final class RuleTable implements NodeRewriter {

    private static final Logger LOG = Logger.getLogger(RuleTable.class.getName());

    private final List<Rule> rules;
    private final PatternMatcher matcher;
    private final Substitutor substitutor;

    private RuleTable(TreeSyntax syntax, List<Rule> rules) {
        this.rules = List.copyOf(rules);
        this.matcher = new PatternMatcher(syntax);
        this.substitutor = new Substitutor(syntax);
    }

    /// A builder for hand-built pattern and template trees.
    public static Builder builder(TreeSyntax syntax) {
        return new Builder(Objects.requireNonNull(syntax, "syntax must not be null"), null);
    }

    /// A builder that also accepts pattern and template text, parsed with `parser`.
    public static Builder builder(SyntaxParser parser) {
        Objects.requireNonNull(parser, "parser must not be null");
        return new Builder(parser.syntax(), parser);
    }

    public List<Rule> rules() {
        return rules;
    }

    @Override
    public Rewrite rewrite(Node node) {
        for (final var rule : rules) {
            final Optional<Captures> captures;
            try {
                captures = matcher.match(rule.pattern(), node);
            } catch (PatternException e) {
                throw e.inRule(rule.name());
            }
            if (captures.isPresent()) {
                LOG.fine(() -> "rule '" + rule.name() + "' matched " + node.kind() + " at " + node.range());
                return apply(rule, captures.get());
            }
        }
        return Rewrite.unchanged();
    }

    private Rewrite apply(Rule rule, Captures captures) {
        final var action = rule.action();
        if (action instanceof Action.Template template) {
            try {
                return Rewrite.replaced(substitutor.substitute(template.template(), captures));
            } catch (PatternException e) {
                throw e.inRule(rule.name());
            }
        }
        if (action instanceof Action.Transform transform) {
            final Node result;
            try {
                result = transform.function().apply(captures);
            } catch (PatternException e) {
                throw e.inRule(rule.name());
            }
            if (result == null) {
                throw new RewriteException("rule '" + rule.name() + "': transform returned null");
            }
            return Rewrite.replaced(result);
        }
        return Rewrite.deleted();
    }

    @Override
    public String toString() {
        return "RuleTable" + rules.stream().map(Rule::name).toList();
    }

    public static final class Builder {
        private final TreeSyntax syntax;
        private final SyntaxParser parser;
        private final List<Rule> rules = new ArrayList<>();

        private Builder(TreeSyntax syntax, SyntaxParser parser) {
            this.syntax = syntax;
            this.parser = parser;
        }

        /// @throws PatternException if the rule is malformed
        public Builder rule(Rule rule) {
            Objects.requireNonNull(rule, "rule must not be null");
            try {
                final var bound = Placeholders.scan(syntax, rule.pattern());
                if (rule.action() instanceof Action.Template template) {
                    final var used = Placeholders.scan(syntax, template.template());
                    for (final var name : used) {
                        if (!bound.contains(name)) {
                            throw new PatternException("template uses placeholder " + name + " which the pattern does not bind");
                        }
                    }
                }
            } catch (PatternException e) {
                throw e.inRule(rule.name());
            }
            rules.add(rule);
            return this;
        }

        public Builder template(String name, Node pattern, Node template) {
            return rule(new Rule(name, pattern, new Action.Template(template)));
        }

        public Builder transform(String name, Node pattern, Function<Captures, Node> function) {
            return rule(new Rule(name, pattern, new Action.Transform(function)));
        }

        public Builder delete(String name, Node pattern) {
            return rule(new Rule(name, pattern, Action.Delete.INSTANCE));
        }

        /// An expression rule from text, named after the rule text.
        public Builder expression(String pattern, String template) {
            return expression(pattern + " => " + template, pattern, template);
        }

        public Builder expression(String name, String pattern, String template) {
            return template(name, parse(name, pattern, false), parse(name, template, false));
        }

        /// A statement rule from text, named after the rule text.
        public Builder statement(String pattern, String template) {
            return statement(pattern + " => " + template, pattern, template);
        }

        public Builder statement(String name, String pattern, String template) {
            return template(name, parse(name, pattern, true), parse(name, template, true));
        }

        public Builder transformExpression(String name, String pattern, Function<Captures, Node> function) {
            return transform(name, parse(name, pattern, false), function);
        }

        public Builder transformStatement(String name, String pattern, Function<Captures, Node> function) {
            return transform(name, parse(name, pattern, true), function);
        }

        public Builder deleteExpression(String pattern) {
            return deleteExpression(pattern + " => delete", pattern);
        }

        public Builder deleteExpression(String name, String pattern) {
            return delete(name, parse(name, pattern, false));
        }

        public Builder deleteStatement(String pattern) {
            return deleteStatement(pattern + " => delete", pattern);
        }

        public Builder deleteStatement(String name, String pattern) {
            return delete(name, parse(name, pattern, true));
        }

        public RuleTable build() {
            return new RuleTable(syntax, rules);
        }

        private Node parse(String name, String text, boolean statement) {
            Objects.requireNonNull(text, "text must not be null");
            if (parser == null) {
                throw new IllegalStateException("rule text needs a builder created with a SyntaxParser");
            }
            try {
                return statement ? parser.parseStatement(text) : parser.parseExpression(text);
            } catch (SourceParseException e) {
                throw new SourceParseException("rule '" + name + "': " + e.getMessage(), e);
            }
        }
    }
}
