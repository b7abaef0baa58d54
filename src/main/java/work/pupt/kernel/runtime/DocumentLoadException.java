package work.pupt.kernel.runtime;

/**
 * Raised when a serialized element tree cannot be turned into elements.
 */
public final class DocumentLoadException extends RuntimeException {
    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
