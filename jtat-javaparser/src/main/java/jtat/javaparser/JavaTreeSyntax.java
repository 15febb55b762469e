package jtat.javaparser;

import jtat.core.Node;
import jtat.core.NodeKind;
import jtat.core.TreeSyntax;

import java.util.Optional;

/// Placeholder shapes of Java trees.
///
/// `_1` and `__1` are written as plain names (`NameExpr`), or as expression statements holding
/// one (`__1;`) to stand for statements in a block. `FieldAccessExpr` and `MethodCallExpr` are
/// attribute-like: `_1._2` and `_1._2(__3)` capture the member name. Lines starting with `//`,
/// `/*` or `*` are comment lines. A deleted statement that is the whole body of an unbraced
/// `if`, `else` or loop becomes `;`.
public final class JavaTreeSyntax implements TreeSyntax {

    public static final JavaTreeSyntax INSTANCE = new JavaTreeSyntax();

    private static final TreeSyntax SHAPES = TreeSyntax.builder()
            .identifier("NameExpr", "name")
            .wrapper("ExpressionStmt", "expression")
            .attribute("FieldAccessExpr", "name", "scope")
            .attribute("MethodCallExpr", "name", "scope")
            .comments("//", "/*", "*")
            .emptyStatement("EmptyStmt")
            .build();

    private JavaTreeSyntax() {}

    @Override
    public String identifierOf(Node node) {
        return SHAPES.identifierOf(node);
    }

    @Override
    public Optional<AttributeFields> attributeFields(NodeKind kind) {
        return SHAPES.attributeFields(kind);
    }

    @Override
    public Node identifier(String name) {
        return SHAPES.identifier(name);
    }

    @Override
    public Node adaptCapture(Node placeholder, Node captured) {
        return SHAPES.adaptCapture(placeholder, captured);
    }

    @Override
    public Optional<Node> emptyStatement() {
        return SHAPES.emptyStatement();
    }

    @Override
    public boolean isBlankOrComment(String line) {
        return SHAPES.isBlankOrComment(line);
    }

    @Override
    public String commentLine(String text) {
        return SHAPES.commentLine(text);
    }
}
