package dev.juridica.rag.conversation;

/**
 * The model answered, but not in the expected structure.
 */
public class MalformedModelOutputException extends RuntimeException {

    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
