package dev.juridica.rag;

/**
 * Raised when an external collaborator (embedding or completion endpoint) cannot
 * serve a request. Callers are expected to degrade instead of aborting the turn.
 */
public class ExternalServiceUnavailableException extends RuntimeException {

    private final String service;

    public ExternalServiceUnavailableException(String service, String message, Throwable cause) {
        super(service + " unavailable: " + message, cause);
        this.service = service;
    }

    public ExternalServiceUnavailableException(String service, String message) {
        this(service, message, null);
    }

    public String getService() {
        return service;
    }
}
