package jtat.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class SourceRewriterTest extends CoreLoggingConfig {

    private static final Logger LOG = Logger.getLogger(SourceRewriterTest.class.getName());

    private final ToyLanguage toy = ToyLanguage.INSTANCE;

    private SourceRewriter rewriter(NodeRewriter rules) {
        return new SourceRewriter(toy, toy, rules);
    }

    private SourceRewriter fooToBaz() {
        return rewriter(RuleTable.builder(toy).expression("foo(_1)", "baz(_1)").build());
    }

    @Test
    void rewrittenStatementKeepsFollowingBlankAndCommentLines() {
        LOG.info(() -> "TEST: rewrittenStatementKeepsFollowingBlankAndCommentLines");

        final var source = "foo(1)\n\n# keep me\nbar(2)\n";

        assertThat(fooToBaz().rewrite(source, "c.toy")).isEqualTo("baz(1)\n\n# keep me\nbar(2)\n");
    }

    @Test
    void fileWithoutMatchesIsByteIdentical() {
        LOG.info(() -> "TEST: fileWithoutMatchesIsByteIdentical");

        final var source = new StringBuilder();
        for (int i = 1; i <= 50; i++) {
            if (i % 10 == 5) {
                source.append("block").append(i).append(" {   # opens\n");
            } else if (i % 10 == 9) {
                source.append("}\n");
            } else if (i % 7 == 0) {
                source.append("\t# comment ").append(i).append('\n');
            } else if (i % 9 == 0) {
                source.append("   \n");
            } else {
                source.append("    call").append(i).append("(x.y,  ").append(i).append(")\n");
            }
        }
        source.append("   last(1)");
        final var text = source.toString();

        assertThat(fooToBaz().rewrite(text, "d.toy")).isEqualTo(text);
    }

    @Test
    void nestedRewriteOnlyTouchesItsLine() {
        LOG.info(() -> "TEST: nestedRewriteOnlyTouchesItsLine");

        final var source = "outer {  # note\n    foo(1)\n    keep(2)\n}\nafter(3)\n";

        assertThat(fooToBaz().rewrite(source, "n.toy"))
                .isEqualTo("outer {  # note\n    baz(1)\n    keep(2)\n}\nafter(3)\n");
    }

    @Test
    void enclosingRewriteCoversNestedOne() {
        LOG.info(() -> "TEST: enclosingRewriteCoversNestedOne");

        final var rules = RuleTable.builder(toy)
                .expression("outer", "inner")
                .expression("foo(_1)", "baz(_1)")
                .build();
        final var source = "outer {\n    foo(1)\n\n    keep(2)\n}\nafter(3)\n";

        assertThat(rewriter(rules).rewrite(source, "n.toy"))
                .isEqualTo("inner {\n    baz(1)\n    keep(2)\n}\nafter(3)\n");
    }

    @Test
    void multiLineReplacementTakesOriginalIndentation() {
        LOG.info(() -> "TEST: multiLineReplacementTakesOriginalIndentation");

        final var rules = RuleTable.builder(toy)
                .transformStatement("guard", "wrap(_1)", captures -> Node.builder(ToyLanguage.BLOCK)
                        .node("head", ToyLanguage.name("guard"))
                        .list("body", Node.builder(ToyLanguage.EXPR).node("value", captures.node("_1")).build())
                        .build())
                .build();

        assertThat(rewriter(rules).rewrite("outer {\n    wrap(x)\n}\n", "m.toy"))
                .isEqualTo("outer {\n    guard {\n        x\n    }\n}\n");
        assertThat(rewriter(rules).rewrite("outer {\r\n    wrap(x)\r\n}\r\n", "m.toy"))
                .isEqualTo("outer {\r\n    guard {\r\n        x\r\n    }\r\n}\r\n");
    }

    @Test
    void deletedStatementTakesItsLineAlong() {
        LOG.info(() -> "TEST: deletedStatementTakesItsLineAlong");

        final var rules = RuleTable.builder(toy).deleteStatement("drop(__1)").build();
        final var source = "keep(1)\n    drop(2, 3)\nkeep(3)\nouter {\n    drop()\n}\n";

        assertThat(rewriter(rules).rewrite(source, "x.toy")).isEqualTo("keep(1)\nkeep(3)\nouter {\n}\n");
    }

    @Test
    void deletedSingleStatementBodyBecomesEmptyStatement() {
        LOG.info(() -> "TEST: deletedSingleStatementBodyBecomesEmptyStatement");

        final var rules = RuleTable.builder(toy).deleteStatement("drop(__1)").build();
        final var source = "when(v)  ->   drop(1)\nwork(2)\nouter {\n    when(w) -> drop()\n}\n";

        assertThat(rewriter(rules).rewrite(source, "g.toy"))
                .isEqualTo("when(v)  ->   pass\nwork(2)\nouter {\n    when(w) -> pass\n}\n");
    }

    @Test
    void deletedSingleStatementBodyWithoutEmptyStatementReRendersOwner() {
        LOG.info(() -> "TEST: deletedSingleStatementBodyWithoutEmptyStatementReRendersOwner");

        final var bare = TreeSyntax.builder()
                .identifier("Name", "id")
                .wrapper("Expr", "value")
                .comments("#")
                .build();
        final var parser = new SyntaxParser() {
            @Override
            public Node parseFile(String source, String fileName) {
                return toy.parseFile(source, fileName);
            }

            @Override
            public Node parseExpression(String text) {
                return toy.parseExpression(text);
            }

            @Override
            public Node parseStatement(String text) {
                return toy.parseStatement(text);
            }

            @Override
            public TreeSyntax syntax() {
                return bare;
            }
        };
        final var rules = RuleTable.builder(parser).deleteStatement("drop(__1)").build();

        assertThat(new SourceRewriter(parser, toy, rules).rewrite("when(v)  ->   drop(1)\nwork(2)\n", "g.toy"))
                .isEqualTo("when(v) -> pass\nwork(2)\n");
    }

    @Test
    void statementRuleReplacesWholeStatement() {
        LOG.info(() -> "TEST: statementRuleReplacesWholeStatement");

        final var rules = RuleTable.builder(toy).statement("log(__1)", "print(__1, System.err)").build();

        assertThat(rewriter(rules).rewrite("a(1)\n  log(1, 2)\nb(2)\n", "s.toy"))
                .isEqualTo("a(1)\n  print(1, 2, System.err)\nb(2)\n");
    }

    @Test
    void rewriteOutsideAnyStatementIsFatal() {
        LOG.info(() -> "TEST: rewriteOutsideAnyStatementIsFatal");

        final var hooks = KindRewriter.builder()
                .on("Module", node -> Rewrite.replaced(Node.builder(ToyLanguage.MODULE).list("body", List.of()).build()))
                .build();

        assertThatThrownBy(() -> rewriter(hooks).rewrite("a(1)\n", "f.toy"))
                .isInstanceOf(RewriteException.class)
                .hasMessageContaining("not enclosed by any statement");
    }

    @Test
    void replacedNodesAreNotRevisited() {
        LOG.info(() -> "TEST: replacedNodesAreNotRevisited");

        final var rewriter = fooToBaz();
        final var once = rewriter.rewrite("foo(1)\nblock {\n    foo(foo(2))\n}\n", "i.toy");

        assertThat(once).isEqualTo("baz(1)\nblock {\n    baz(foo(2))\n}\n");
        assertThat(rewriter.rewrite(once, "i.toy")).isEqualTo("baz(1)\nblock {\n    baz(baz(2))\n}\n");
    }

    @Test
    void separatorsMarkRegions() {
        LOG.info(() -> "TEST: separatorsMarkRegions");

        final var rules = RuleTable.builder(toy).expression("foo(_1)", "baz(_1)").build();
        final var rewriter = new SourceRewriter(toy, toy, rules, new RewriteSettings(true));

        final var output = rewriter.rewrite("a(0)\nfoo(1)\nbar(2)\n", "s.toy");

        assertThat(output).contains(
                "#=# dump from line 1\na(0)\n#=# to line 1\n",
                "#=# generated code from line 2\nbaz(1)\n#=# end generated code to line 2\n",
                "#=# dump after line 2\n",
                "#=# to the end\n");
    }

    @Test
    void rendererExhaustionIsFatal() {
        LOG.info(() -> "TEST: rendererExhaustionIsFatal");

        final Renderer unavailable = new Renderer() {
            @Override
            public String render(Node node) {
                throw new RendererUnavailableException("not installed");
            }

            @Override
            public String name() {
                return "absent";
            }
        };
        final var rules = RuleTable.builder(toy).expression("foo(_1)", "baz(_1)").build();
        final var rewriter = new SourceRewriter(toy, RendererChain.of(unavailable), rules);

        final var thrown = catchThrowable(() -> rewriter.rewrite("foo(1)\n", "r.toy"));

        assertThat(thrown).isInstanceOf(RewriteException.class).hasMessageContaining("absent");
        assertThat(thrown.getSuppressed()).hasSize(1);
    }

    @Test
    void rendererChainFallsThrough() {
        LOG.info(() -> "TEST: rendererChainFallsThrough");

        final Renderer unavailable = new Renderer() {
            @Override
            public String render(Node node) {
                throw new RendererUnavailableException("not installed");
            }

            @Override
            public String name() {
                return "absent";
            }
        };
        final var chain = RendererChain.of(unavailable, toy);

        assertThat(chain.render(toy.parseExpression("f(a.b)"))).isEqualTo("f(a.b)");
        assertThat(chain.name()).isEqualTo("absent,toy");
    }

    @Test
    void inPlaceRewriteReplacesFile(@TempDir Path dir) throws IOException {
        LOG.info(() -> "TEST: inPlaceRewriteReplacesFile");

        final var file = dir.resolve("target.toy");
        Files.writeString(file, "foo(1)\nbar(2)\n");

        fooToBaz().rewriteInPlace(file);

        assertThat(Files.readString(file)).isEqualTo("baz(1)\nbar(2)\n");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void failedInPlaceRewriteLeavesFileAndNoTemporary(@TempDir Path dir) throws IOException {
        LOG.info(() -> "TEST: failedInPlaceRewriteLeavesFileAndNoTemporary");

        final var file = dir.resolve("target.toy");
        Files.writeString(file, "foo(1)\nbar(2)\n");
        final var failing = KindRewriter.builder()
                .on("Num", node -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        assertThatThrownBy(() -> rewriter(failing).rewriteInPlace(file)).hasMessage("boom");

        assertThat(Files.readString(file)).isEqualTo("foo(1)\nbar(2)\n");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void streamsToOutputStream(@TempDir Path dir) throws IOException {
        LOG.info(() -> "TEST: streamsToOutputStream");

        final var file = dir.resolve("target.toy");
        Files.writeString(file, "x(1)\nfoo(2)\n");
        final var out = new ByteArrayOutputStream();

        fooToBaz().rewriteTo(file, out);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("x(1)\nbaz(2)\n");
        assertThat(fooToBaz().rewriteFile(file)).isEqualTo("x(1)\nbaz(2)\n");
    }

    @Test
    void brokenPipeIsRecognised() {
        LOG.info(() -> "TEST: brokenPipeIsRecognised");

        assertThat(SourceRewriter.isBrokenPipe(new IOException("Broken pipe"))).isTrue();
        assertThat(SourceRewriter.isBrokenPipe(new IOException("wrapped", new IOException("Broken pipe (Write failed)")))).isTrue();
        assertThat(SourceRewriter.isBrokenPipe(new IOException("No space left on device"))).isFalse();
    }

    @Test
    void parseFailureIsReported() {
        LOG.info(() -> "TEST: parseFailureIsReported");

        assertThatThrownBy(() -> fooToBaz().rewrite("outer {\n    a(1)\n", "p.toy"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("p.toy");
    }
}
