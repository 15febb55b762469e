package jtat.core;

/// Turns a (possibly rewritten) node back into source text.
public interface Renderer {

    /// @throws RendererUnavailableException if this renderer cannot run here or cannot render
    ///         this kind of node
    String render(Node node);

    /// Short name used in configuration and log lines.
    String name();
}
