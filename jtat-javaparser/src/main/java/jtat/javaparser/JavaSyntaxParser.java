package jtat.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import jtat.core.Node;
import jtat.core.SourceParseException;
import jtat.core.SyntaxParser;
import jtat.core.TreeSyntax;

import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Parses Java sources and rule text with JavaParser.
///
/// Comments are not attributed to nodes; they stay in the original text, which is copied
/// verbatim wherever nothing was rewritten. A fresh [JavaParser] is created per call.
public final class JavaSyntaxParser implements SyntaxParser {

    private static final Logger LOG = Logger.getLogger(JavaSyntaxParser.class.getName());

    private final ParserConfiguration configuration;
    private final JavaTreeConverter converter;

    public JavaSyntaxParser(JavaSettings settings, JavaTreeConverter converter) {
        Objects.requireNonNull(settings, "settings must not be null");
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(settings.languageLevel())
                .setAttributeComments(false);
    }

    public JavaSyntaxParser(JavaSettings settings) {
        this(settings, new JavaTreeConverter());
    }

    @Override
    public Node parseFile(String source, String fileName) {
        Objects.requireNonNull(source, "source must not be null");
        final var result = parser().parse(source);
        LOG.finer(() -> "parsed " + fileName + ": " + result.getProblems().size() + " problem(s)");
        return converter.toGeneric(unwrap(result, fileName));
    }

    @Override
    public Node parseExpression(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return converter.toGeneric(unwrap(parser().parseExpression(text), "expression '" + text + "'"));
    }

    /// Parses a statement; text that is not a statement is tried as a member declaration, then
    /// as an import, so rules can rewrite methods, fields and imports too.
    @Override
    public Node parseStatement(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var parser = parser();
        final var statement = parser.parseStatement(text);
        if (statement.isSuccessful()) {
            return converter.toGeneric(statement.getResult().orElseThrow());
        }
        final var member = parser.parseBodyDeclaration(text);
        if (member.isSuccessful()) {
            return converter.toGeneric(member.getResult().orElseThrow());
        }
        final var importDeclaration = parser.parseImport(text);
        if (importDeclaration.isSuccessful()) {
            return converter.toGeneric(importDeclaration.getResult().orElseThrow());
        }
        return converter.toGeneric(unwrap(statement, "statement '" + text + "'"));
    }

    @Override
    public TreeSyntax syntax() {
        return JavaTreeSyntax.INSTANCE;
    }

    public JavaTreeConverter converter() {
        return converter;
    }

    private JavaParser parser() {
        return new JavaParser(configuration);
    }

    private static <T extends com.github.javaparser.ast.Node> T unwrap(ParseResult<T> result, String what) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        final var problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
        throw new SourceParseException("cannot parse " + what + ": " + problems);
    }
}
