package jtat.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The language-specific shapes the engine needs to know about.
///
/// The matcher and substitutor are generic over node kinds; a language tells them which nodes are
/// identifier-shaped (and so may be placeholders), which kinds carry an attribute name next to an
/// owner expression, how to build an identifier node, and what a comment line looks like.
///
/// Most languages can be described with [#builder()].
public interface TreeSyntax {

    /// The identifier carried by an identifier-shaped node, or null if the node is not one.
    String identifierOf(Node node);

    /// For attribute-like kinds (`owner.attr`), the names of the attribute and owner fields.
    Optional<AttributeFields> attributeFields(NodeKind kind);

    /// A fresh identifier-shaped node, used when a captured scalar lands where a node is expected.
    Node identifier(String name);

    /// Fits a captured node into the position held by a template placeholder.
    ///
    /// The default places the capture as-is. Languages where a placeholder can stand for a
    /// statement wrapping an expression re-wrap expression captures here.
    default Node adaptCapture(Node placeholder, Node captured) {
        return captured;
    }

    /// A statement that does nothing, put in place of a deleted statement that fills a single-node
    /// slot (an unbraced loop or branch body), where cutting the text out would let the next
    /// statement take its place. Empty when the language has none; the enclosing statement is
    /// then re-rendered without the deleted one.
    default Optional<Node> emptyStatement() {
        return Optional.empty();
    }

    /// Whether a line of original source holds no code: blank, or a comment only.
    boolean isBlankOrComment(String line);

    /// A single-line comment carrying the given text, used for debug separators.
    String commentLine(String text);

    static Builder builder() {
        return new Builder();
    }

    /// @param attribute the field holding the attribute name as a scalar
    /// @param owner the field holding the expression the attribute is read from
    record AttributeFields(String attribute, String owner) {
        public AttributeFields {
            Objects.requireNonNull(attribute, "attribute must not be null");
            Objects.requireNonNull(owner, "owner must not be null");
        }
    }

    /// Describes a language by kind names and field names.
    final class Builder {
        private String identifierKind;
        private String identifierField;
        private String wrapperKind;
        private String wrapperField;
        private final Map<String, AttributeFields> attributes = new LinkedHashMap<>();
        private final List<String> commentPrefixes = new ArrayList<>();
        private String lineComment;
        private String emptyStatementKind;

        private Builder() {}

        /// The node kind for identifiers, and its scalar field holding the name.
        public Builder identifier(String kind, String field) {
            this.identifierKind = Objects.requireNonNull(kind, "kind must not be null");
            this.identifierField = Objects.requireNonNull(field, "field must not be null");
            return this;
        }

        /// A statement kind that wraps a single expression field; a wrapped identifier counts as
        /// identifier-shaped, so placeholders can stand for whole statements in a body.
        public Builder wrapper(String kind, String field) {
            this.wrapperKind = Objects.requireNonNull(kind, "kind must not be null");
            this.wrapperField = Objects.requireNonNull(field, "field must not be null");
            return this;
        }

        public Builder attribute(String kind, String attributeField, String ownerField) {
            attributes.put(Objects.requireNonNull(kind, "kind must not be null"), new AttributeFields(attributeField, ownerField));
            return this;
        }

        /// The kind of a field-less statement that does nothing, such as `;` in C-like languages.
        public Builder emptyStatement(String kind) {
            this.emptyStatementKind = Objects.requireNonNull(kind, "kind must not be null");
            return this;
        }

        /// Line prefixes that make a stripped line comment-only. The first one also starts the
        /// debug separator lines.
        public Builder comments(String... prefixes) {
            for (final var prefix : prefixes) {
                commentPrefixes.add(Objects.requireNonNull(prefix, "prefix must not be null"));
            }
            if (lineComment == null && prefixes.length > 0) {
                lineComment = prefixes[0];
            }
            return this;
        }

        public TreeSyntax build() {
            if (identifierKind == null) {
                throw new IllegalStateException("identifier kind must be set");
            }
            if (lineComment == null) {
                throw new IllegalStateException("at least one comment prefix must be set");
            }
            return new SimpleTreeSyntax(identifierKind, identifierField, wrapperKind, wrapperField,
                    Map.copyOf(attributes), List.copyOf(commentPrefixes), lineComment, emptyStatementKind);
        }
    }
}
