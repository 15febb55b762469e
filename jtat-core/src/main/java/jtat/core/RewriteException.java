package jtat.core;

/// Exception thrown when a source file cannot be rewritten.
///
/// Every failure of the engine is fatal for the file being rewritten; there is no partial-file
/// recovery. Subclasses narrow the cause.
@SuppressWarnings("serial")
public class RewriteException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RewriteException(String message) {
        super(message);
    }

    public RewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
