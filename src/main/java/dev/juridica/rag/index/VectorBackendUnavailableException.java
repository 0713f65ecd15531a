package dev.juridica.rag.index;

/**
 * Raised by a vector backend that cannot serve a search or an update. The
 * retrieval chain falls back to the next backend.
 */
public class VectorBackendUnavailableException extends RuntimeException {

    public VectorBackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
