package jtat.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTableTest extends CoreLoggingConfig {

    private static final Logger LOG = Logger.getLogger(RuleTableTest.class.getName());

    private final ToyLanguage toy = ToyLanguage.INSTANCE;

    @Test
    void firstMatchingRuleWins() {
        LOG.info(() -> "TEST: firstMatchingRuleWins");

        final var table = RuleTable.builder(toy)
                .expression("first", "f(_1)", "one(_1)")
                .expression("second", "f(1)", "two()")
                .build();

        final var rewrite = table.rewrite(toy.parseExpression("f(1)"));

        assertThat(rewrite).isEqualTo(Rewrite.replaced(toy.parseExpression("one(1)")));
    }

    @Test
    void unmatchedNodeIsUnchanged() {
        LOG.info(() -> "TEST: unmatchedNodeIsUnchanged");

        final var table = RuleTable.builder(toy).expression("f(_1)", "g(_1)").build();

        assertThat(table.rewrite(toy.parseExpression("h(1)"))).isSameAs(Rewrite.unchanged());
    }

    @Test
    void deleteRuleDeletes() {
        LOG.info(() -> "TEST: deleteRuleDeletes");

        final var table = RuleTable.builder(toy).deleteStatement("debug(__1)").build();

        assertThat(table.rewrite(toy.parseStatement("debug(1, 2)"))).isSameAs(Rewrite.deleted());
        assertThat(table.rules()).extracting(Rule::name).containsExactly("debug(__1) => delete");
    }

    @Test
    void transformBuildsReplacementFromCaptures() {
        LOG.info(() -> "TEST: transformBuildsReplacementFromCaptures");

        final var table = RuleTable.builder(toy)
                .transformExpression("count", "count(__1)", captures -> ToyLanguage.num(captures.nodes("__1").size()))
                .build();

        assertThat(table.rewrite(toy.parseExpression("count(a, b, c)")))
                .isEqualTo(Rewrite.replaced(ToyLanguage.num(3)));
    }

    @Test
    void transformReturningNullIsAnError() {
        LOG.info(() -> "TEST: transformReturningNullIsAnError");

        final var table = RuleTable.builder(toy).transformExpression("broken", "f(_1)", captures -> null).build();

        assertThatThrownBy(() -> table.rewrite(toy.parseExpression("f(1)")))
                .isInstanceOf(RewriteException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void templateMayOnlyUseBoundPlaceholders() {
        LOG.info(() -> "TEST: templateMayOnlyUseBoundPlaceholders");

        final var builder = RuleTable.builder(toy);

        assertThatThrownBy(() -> builder.expression("needs-two", "f(_1)", "g(_1, _2)"))
                .isInstanceOfSatisfying(PatternException.class, e -> {
                    assertThat(e.ruleName()).isEqualTo("needs-two");
                    assertThat(e.getMessage()).contains("_2");
                });
    }

    @Test
    void twoVariadicsInAListAreRejectedAtConstruction() {
        LOG.info(() -> "TEST: twoVariadicsInAListAreRejectedAtConstruction");

        assertThatThrownBy(() -> RuleTable.builder(toy).expression("greedy", "f(__1, __2)", "g(__1)"))
                .isInstanceOf(PatternException.class)
                .hasMessageStartingWith("rule 'greedy':");
        assertThatThrownBy(() -> RuleTable.builder(toy).expression("greedy-template", "f(__1)", "g(__1, __1)"))
                .isInstanceOf(PatternException.class);
    }

    @Test
    void variadicOutsideListIsRejected() {
        LOG.info(() -> "TEST: variadicOutsideListIsRejected");

        assertThatThrownBy(() -> RuleTable.builder(toy).expression("loose", "__1.size", "x"))
                .isInstanceOf(PatternException.class)
                .hasMessageContaining("inside a list");
    }

    @Test
    void ruleTextNeedsParser() {
        LOG.info(() -> "TEST: ruleTextNeedsParser");

        final var builder = RuleTable.builder(ToyLanguage.SYNTAX);

        assertThatThrownBy(() -> builder.expression("f(_1)", "g(_1)")).isInstanceOf(IllegalStateException.class);
        assertThat(builder.template("hand-built", toy.parseExpression("f(_1)"), toy.parseExpression("g(_1)"))
                .build().rules()).hasSize(1);
    }

    @Test
    void unparsableRuleTextNamesTheRule() {
        LOG.info(() -> "TEST: unparsableRuleTextNamesTheRule");

        assertThatThrownBy(() -> RuleTable.builder(toy).expression("bad", "f(", "g()"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageStartingWith("rule 'bad':");
    }

    @Test
    void kindRewriterFallsBackToUnchanged() {
        LOG.info(() -> "TEST: kindRewriterFallsBackToUnchanged");

        final var hooks = KindRewriter.builder()
                .on("Num", node -> Rewrite.replaced(ToyLanguage.num(0)))
                .build();

        assertThat(hooks.rewrite(ToyLanguage.num(7))).isEqualTo(Rewrite.replaced(ToyLanguage.num(0)));
        assertThat(hooks.rewrite(ToyLanguage.name("x"))).isSameAs(Rewrite.unchanged());
        assertThatThrownBy(() -> KindRewriter.builder().on("Num", n -> Rewrite.deleted()).on("Num", n -> Rewrite.deleted()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void orElseConsultsNextRewriterOnlyWhenUnchanged() {
        LOG.info(() -> "TEST: orElseConsultsNextRewriterOnlyWhenUnchanged");

        final var table = RuleTable.builder(toy).expression("f(_1)", "g(_1)").build();
        final NodeRewriter combined = table.orElse(node -> Rewrite.deleted());

        assertThat(combined.rewrite(toy.parseExpression("f(1)"))).isEqualTo(Rewrite.replaced(toy.parseExpression("g(1)")));
        assertThat(combined.rewrite(toy.parseExpression("h(1)"))).isSameAs(Rewrite.deleted());
    }

    @Test
    void placeholderScanListsNamesInOrder() {
        LOG.info(() -> "TEST: placeholderScanListsNamesInOrder");

        final var names = Placeholders.scan(ToyLanguage.SYNTAX, toy.parseExpression("f(_2, x._1, __3, _2)"));

        assertThat(List.copyOf(names)).containsExactly("_2", "_1", "__3");
    }
}
