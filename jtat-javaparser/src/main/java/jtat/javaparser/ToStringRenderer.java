package jtat.javaparser;

import jtat.core.Node;
import jtat.core.Renderer;

import java.util.Objects;

/// Renders with JavaParser's own `toString()`, using its default printer settings.
public final class ToStringRenderer implements Renderer {

    private final JavaTreeConverter converter;

    public ToStringRenderer(JavaTreeConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter must not be null");
    }

    @Override
    public String render(Node node) {
        return converter.toJava(node).toString();
    }

    @Override
    public String name() {
        return "plain";
    }
}
