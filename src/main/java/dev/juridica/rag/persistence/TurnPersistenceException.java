package dev.juridica.rag.persistence;

/**
 * Storing a question and its answer failed; the transaction was rolled back.
 */
public class TurnPersistenceException extends RuntimeException {

    public TurnPersistenceException(String conversationId, Throwable cause) {
        super("Unable to persist turn of conversation " + conversationId, cause);
    }
}
