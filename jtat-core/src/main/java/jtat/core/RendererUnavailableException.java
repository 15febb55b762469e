package jtat.core;

/// A renderer cannot be used in this runtime, for example because its backing library is missing.
///
/// [RendererChain] recovers from this by trying the next renderer.
@SuppressWarnings("serial")
public final class RendererUnavailableException extends RewriteException {

    private static final long serialVersionUID = 1L;

    public RendererUnavailableException(String message) {
        super(message);
    }

    public RendererUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
