package jtat.javaparser;

import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;
import com.github.javaparser.printer.configuration.Indentation;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import jtat.core.Node;
import jtat.core.Renderer;
import jtat.core.RendererUnavailableException;

import java.util.Objects;

/// Renders with JavaParser's [DefaultPrettyPrinter]: configured indentation, `\n` line ends, no
/// comments.
public final class PrettyPrinterRenderer implements Renderer {

    private final JavaTreeConverter converter;
    private final DefaultPrettyPrinter printer;

    public PrettyPrinterRenderer(JavaTreeConverter converter, int indent) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
        final var configuration = new DefaultPrinterConfiguration();
        configuration.addOption(new DefaultConfigurationOption(ConfigOption.INDENTATION, new Indentation(IndentType.SPACES, indent)));
        configuration.addOption(new DefaultConfigurationOption(ConfigOption.END_OF_LINE_CHARACTER, "\n"));
        configuration.removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS));
        configuration.removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_JAVADOC));
        this.printer = new DefaultPrettyPrinter(configuration);
    }

    @Override
    public String render(Node node) {
        final var java = converter.toJava(node);
        try {
            return printer.print(java);
        } catch (LinkageError e) {
            throw new RendererUnavailableException("pretty printer cannot run: " + e, e);
        }
    }

    @Override
    public String name() {
        return "pretty";
    }
}
