package jtat.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/// A tiny line-oriented language for exercising the engine without a real parser.
///
/// One statement per line: an expression (`foo(1, x.y)`), or a block opened by `head {` and
/// closed by a line holding only `}`, or a guarded statement `test -> statement` whose body is a
/// single statement rather than a list. `#` starts a comment. Only blocks report where they end,
/// at their closing brace; every other node carries its start position alone.
final class ToyLanguage implements SyntaxParser, Renderer {

    static final NodeKind MODULE = NodeKind.expression("Module");
    static final NodeKind EXPR = NodeKind.statement("Expr");
    static final NodeKind BLOCK = NodeKind.statement("Block");
    static final NodeKind GUARD = NodeKind.statement("Guard");
    static final NodeKind NAME = NodeKind.expression("Name");
    static final NodeKind NUM = NodeKind.expression("Num");
    static final NodeKind CALL = NodeKind.expression("Call");
    static final NodeKind ATTRIBUTE = NodeKind.expression("Attribute");

    static final TreeSyntax SYNTAX = TreeSyntax.builder()
            .identifier("Name", "id")
            .wrapper("Expr", "value")
            .attribute("Attribute", "attr", "value")
            .comments("#")
            .emptyStatement("Pass")
            .build();

    static final ToyLanguage INSTANCE = new ToyLanguage();

    @Override
    public Node parseFile(String source, String fileName) {
        final var lines = source.split("\\R", -1);
        final Deque<Node> heads = new ArrayDeque<>();
        final Deque<List<Node>> bodies = new ArrayDeque<>();
        bodies.push(new ArrayList<>());
        for (int i = 0; i < lines.length; i++) {
            final var lineNo = i + 1;
            final var hash = lines[i].indexOf('#');
            final var code = hash >= 0 ? lines[i].substring(0, hash) : lines[i];
            final var stripped = code.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            final var column = code.indexOf(stripped.charAt(0)) + 1;
            if (stripped.equals("}")) {
                if (heads.isEmpty()) {
                    throw new SourceParseException(fileName + ":" + lineNo + ": unbalanced }");
                }
                final var head = heads.pop();
                final var body = bodies.pop();
                final var begin = head.range().begin();
                bodies.peek().add(Node.builder(BLOCK).node("head", head).list("body", body)
                        .range(SourceRange.of(begin.line(), begin.column(), lineNo, column)).build());
            } else if (stripped.endsWith("{")) {
                final var headText = stripped.substring(0, stripped.length() - 1).strip();
                // the block starts where its head does
                heads.push(new ExpressionParser(headText, lineNo, column).parse());
                bodies.push(new ArrayList<>());
            } else if (stripped.contains(" -> ")) {
                final var arrow = code.indexOf(" -> ");
                final var thenText = code.substring(arrow + 4).strip();
                final var thenColumn = code.indexOf(thenText, arrow + 4) + 1;
                final var test = new ExpressionParser(code.substring(0, arrow).strip(), lineNo, column).parse();
                final var then = Node.builder(EXPR)
                        .node("value", new ExpressionParser(thenText, lineNo, thenColumn).parse())
                        .at(lineNo, thenColumn).build();
                bodies.peek().add(Node.builder(GUARD).node("test", test).node("then", then).at(lineNo, column).build());
            } else {
                final var value = new ExpressionParser(stripped, lineNo, column).parse();
                bodies.peek().add(Node.builder(EXPR).node("value", value).at(lineNo, column).build());
            }
        }
        if (!heads.isEmpty()) {
            throw new SourceParseException(fileName + ": block at line " + heads.peek().line() + " is not closed");
        }
        return Node.builder(MODULE).list("body", bodies.pop()).build();
    }

    @Override
    public Node parseExpression(String text) {
        return new ExpressionParser(text.strip(), 1, 1).parse();
    }

    @Override
    public Node parseStatement(String text) {
        final var value = parseExpression(text);
        return Node.builder(EXPR).node("value", value).at(1, 1).build();
    }

    @Override
    public TreeSyntax syntax() {
        return SYNTAX;
    }

    @Override
    public String render(Node node) {
        return switch (node.kind().name()) {
            case "Module" -> nodes(node, "body").stream().map(this::render).collect(Collectors.joining("\n"));
            case "Expr" -> render(child(node, "value"));
            case "Block" -> {
                final var out = new StringBuilder(render(child(node, "head"))).append(" {\n");
                for (final var statement : nodes(node, "body")) {
                    for (final var line : render(statement).split("\n")) {
                        out.append("    ").append(line).append('\n');
                    }
                }
                yield out.append('}').toString();
            }
            case "Guard" -> render(child(node, "test")) + " -> "
                    + (node.field("then") instanceof FieldValue.NodeValue then ? render(then.node()) : "pass");
            case "Pass" -> "pass";
            case "Name" -> String.valueOf(((FieldValue.Scalar) node.field("id")).value());
            case "Num" -> String.valueOf(((FieldValue.Scalar) node.field("value")).value());
            case "Call" -> render(child(node, "func")) + "("
                    + nodes(node, "args").stream().map(this::render).collect(Collectors.joining(", ")) + ")";
            case "Attribute" -> render(child(node, "value")) + "." + ((FieldValue.Scalar) node.field("attr")).value();
            default -> throw new RendererUnavailableException("toy renderer cannot render " + node.kind());
        };
    }

    @Override
    public String name() {
        return "toy";
    }

    static Node name(String id) {
        return Node.builder(NAME).scalar("id", id).build();
    }

    static Node num(int value) {
        return Node.builder(NUM).scalar("value", value).build();
    }

    private static Node child(Node node, String field) {
        return ((FieldValue.NodeValue) node.field(field)).node();
    }

    private static List<Node> nodes(Node node, String field) {
        return ((FieldValue.ListValue) node.field(field)).nodes();
    }

    private static final class ExpressionParser {
        private final String text;
        private final int line;
        private final int column;
        private int pos;

        ExpressionParser(String text, int line, int column) {
            this.text = text;
            this.line = line;
            this.column = column;
        }

        Node parse() {
            final var node = expression();
            skipSpaces();
            if (pos != text.length()) {
                throw error("unexpected '" + text.charAt(pos) + "'");
            }
            return node;
        }

        private Node expression() {
            skipSpaces();
            final var start = pos;
            var node = primary();
            while (true) {
                skipSpaces();
                if (peek('(')) {
                    pos++;
                    final var args = new ArrayList<Node>();
                    skipSpaces();
                    if (!peek(')')) {
                        args.add(expression());
                        skipSpaces();
                        while (peek(',')) {
                            pos++;
                            args.add(expression());
                            skipSpaces();
                        }
                    }
                    expect(')');
                    node = Node.builder(CALL).node("func", node).list("args", args).at(line, column + start).build();
                } else if (peek('.')) {
                    pos++;
                    skipSpaces();
                    final var attr = identifier();
                    node = Node.builder(ATTRIBUTE).node("value", node).scalar("attr", attr).at(line, column + start).build();
                } else {
                    return node;
                }
            }
        }

        private Node primary() {
            final var start = pos;
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
                return Node.builder(NUM).scalar("value", Integer.parseInt(text.substring(start, pos)))
                        .at(line, column + start).build();
            }
            final var id = identifier();
            return Node.builder(NAME).scalar("id", id).at(line, column + start).build();
        }

        private String identifier() {
            final var start = pos;
            if (pos >= text.length() || !Character.isJavaIdentifierStart(text.charAt(pos))) {
                throw error("expected a name");
            }
            while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) pos++;
            return text.substring(start, pos);
        }

        private void expect(char c) {
            if (!peek(c)) {
                throw error("expected '" + c + "'");
            }
            pos++;
        }

        private boolean peek(char c) {
            return pos < text.length() && text.charAt(pos) == c;
        }

        private void skipSpaces() {
            while (pos < text.length() && text.charAt(pos) == ' ') pos++;
        }

        private SourceParseException error(String message) {
            return new SourceParseException(line + ":" + (column + pos) + ": " + message + " in '" + text + "'");
        }
    }
}
