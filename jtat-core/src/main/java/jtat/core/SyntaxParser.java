package jtat.core;

/// Turns source text into generic [Node] trees for one language.
///
/// Every parsed node carries its start position, and its end position where the underlying
/// parser reports one. Statement-kind nodes are marked through their [NodeKind].
public interface SyntaxParser {

    /// @throws SourceParseException if the source is not valid
    Node parseFile(String source, String fileName);

    /// Parses a single expression, as used for expression patterns and templates.
    Node parseExpression(String text);

    /// Parses a single statement, as used for statement patterns and templates.
    Node parseStatement(String text);

    /// The shapes of this language's trees the matcher needs.
    TreeSyntax syntax();
}
