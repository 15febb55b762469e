package jtat.core;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Renderers in priority order; the first that is available renders the node.
public final class RendererChain implements Renderer {

    private static final Logger LOG = Logger.getLogger(RendererChain.class.getName());

    private final List<Renderer> renderers;

    public RendererChain(List<Renderer> renderers) {
        Objects.requireNonNull(renderers, "renderers must not be null");
        if (renderers.isEmpty()) {
            throw new IllegalArgumentException("at least one renderer is required");
        }
        this.renderers = List.copyOf(renderers);
    }

    public static RendererChain of(Renderer... renderers) {
        return new RendererChain(List.of(renderers));
    }

    public List<Renderer> renderers() {
        return renderers;
    }

    /// @throws RewriteException if no renderer in the chain is available
    @Override
    public String render(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        RewriteException failure = null;
        for (final var renderer : renderers) {
            try {
                return renderer.render(node);
            } catch (RendererUnavailableException e) {
                LOG.fine(() -> "renderer " + renderer.name() + " unavailable for " + node.kind() + ": " + e.getMessage());
                if (failure == null) {
                    failure = new RewriteException("no renderer available for " + node.kind() + ", tried " + name());
                }
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }

    @Override
    public String name() {
        final var names = new StringBuilder();
        for (final var renderer : renderers) {
            if (names.length() > 0) names.append(',');
            names.append(renderer.name());
        }
        return names.toString();
    }
}
