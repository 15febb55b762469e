package jtat.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// [TreeSyntax] described by kind and field names; built through [TreeSyntax#builder()].
final class SimpleTreeSyntax implements TreeSyntax {

    private final String identifierKind;
    private final String identifierField;
    private final String wrapperKind;
    private final String wrapperField;
    private final Map<String, AttributeFields> attributes;
    private final List<String> commentPrefixes;
    private final String lineComment;
    private final String emptyStatementKind;

    SimpleTreeSyntax(String identifierKind, String identifierField, String wrapperKind, String wrapperField,
                     Map<String, AttributeFields> attributes, List<String> commentPrefixes, String lineComment,
                     String emptyStatementKind) {
        this.identifierKind = identifierKind;
        this.identifierField = identifierField;
        this.wrapperKind = wrapperKind;
        this.wrapperField = wrapperField;
        this.attributes = attributes;
        this.commentPrefixes = commentPrefixes;
        this.lineComment = lineComment;
        this.emptyStatementKind = emptyStatementKind;
    }

    @Override
    public String identifierOf(Node node) {
        final var name = node.kind().name();
        if (name.equals(identifierKind)) {
            return node.field(identifierField) instanceof FieldValue.Scalar s && s.value() instanceof String id ? id : null;
        }
        if (name.equals(wrapperKind) && node.field(wrapperField) instanceof FieldValue.NodeValue wrapped
                && wrapped.node().kind().name().equals(identifierKind)) {
            return identifierOf(wrapped.node());
        }
        return null;
    }

    @Override
    public Optional<AttributeFields> attributeFields(NodeKind kind) {
        return Optional.ofNullable(attributes.get(kind.name()));
    }

    @Override
    public Node identifier(String name) {
        return Node.of(NodeKind.expression(identifierKind), Map.of(identifierField, new FieldValue.Scalar(name)));
    }

    @Override
    public Node adaptCapture(Node placeholder, Node captured) {
        if (wrapperKind == null) {
            return captured;
        }
        final var placeholderWraps = placeholder.kind().name().equals(wrapperKind);
        final var capturedWraps = captured.kind().name().equals(wrapperKind);
        if (placeholderWraps && !capturedWraps && !captured.isStatement()) {
            // an expression capture standing where the template had `_1;`
            return Node.of(placeholder.kind(), Map.of(wrapperField, FieldValue.of(captured)));
        }
        if (!placeholderWraps && capturedWraps && !placeholder.isStatement()
                && captured.field(wrapperField) instanceof FieldValue.NodeValue inner) {
            return inner.node();
        }
        return captured;
    }

    @Override
    public Optional<Node> emptyStatement() {
        return emptyStatementKind == null
                ? Optional.empty()
                : Optional.of(Node.of(NodeKind.statement(emptyStatementKind), Map.of()));
    }

    @Override
    public boolean isBlankOrComment(String line) {
        final var stripped = line.strip();
        if (stripped.isEmpty()) {
            return true;
        }
        for (final var prefix : commentPrefixes) {
            if (stripped.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String commentLine(String text) {
        return lineComment + text;
    }
}
