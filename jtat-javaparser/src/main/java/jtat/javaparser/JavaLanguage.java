package jtat.javaparser;

import jtat.core.NodeRewriter;
import jtat.core.Renderer;
import jtat.core.RendererChain;
import jtat.core.RewriteSettings;
import jtat.core.RuleTable;
import jtat.core.SourceRewriter;
import jtat.core.TreeSyntax;

import java.util.ArrayList;
import java.util.Objects;

/// Wires the Java collaborators together: parser, renderers, and rewriters built on them.
///
/// ```java
/// final var java = JavaLanguage.create(JavaSettings.defaults());
/// final var rules = java.rules()
///         .expression("print(__1)", "print(__1, System.out)")
///         .build();
/// final var output = java.rewriter(rules).rewrite(source, "Example.java");
/// ```
public final class JavaLanguage {

    private final JavaSettings settings;
    private final JavaTreeConverter converter;
    private final JavaSyntaxParser parser;
    private final RendererChain renderer;

    private JavaLanguage(JavaSettings settings) {
        this.settings = settings;
        this.converter = new JavaTreeConverter();
        this.parser = new JavaSyntaxParser(settings, converter);
        final var renderers = new ArrayList<Renderer>();
        for (final var name : settings.renderers()) {
            renderers.add(renderer(name));
        }
        this.renderer = new RendererChain(renderers);
    }

    public static JavaLanguage create(JavaSettings settings) {
        return new JavaLanguage(Objects.requireNonNull(settings, "settings must not be null"));
    }

    public static JavaLanguage fromSystemProperties() {
        return create(JavaSettings.fromSystemProperties());
    }

    private Renderer renderer(String name) {
        switch (name) {
            case "pretty":
                return new PrettyPrinterRenderer(converter, settings.indent());
            case "plain":
                return new ToStringRenderer(converter);
            default:
                throw new IllegalArgumentException("unknown renderer '" + name + "', expected pretty or plain");
        }
    }

    public JavaSettings settings() {
        return settings;
    }

    public JavaSyntaxParser parser() {
        return parser;
    }

    public TreeSyntax syntax() {
        return parser.syntax();
    }

    public RendererChain renderer() {
        return renderer;
    }

    public JavaTreeConverter converter() {
        return converter;
    }

    /// A rule table builder that parses rule text as Java.
    public RuleTable.Builder rules() {
        return RuleTable.builder(parser);
    }

    public SourceRewriter rewriter(NodeRewriter rewriter, RewriteSettings rewriteSettings) {
        return new SourceRewriter(parser, renderer, rewriter, rewriteSettings);
    }

    public SourceRewriter rewriter(NodeRewriter rewriter) {
        return rewriter(rewriter, RewriteSettings.fromSystemProperties());
    }
}
