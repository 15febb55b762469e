package jtat.core;

/// The parser collaborator rejected a source file or a pattern text.
@SuppressWarnings("serial")
public final class SourceParseException extends RewriteException {

    private static final long serialVersionUID = 1L;

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
