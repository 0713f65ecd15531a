package dev.juridica.rag.document;

/**
 * Outcome of the document request detection.
 */
public record DocumentRequest(boolean isRequest, DocumentFormat format) {

    private static final DocumentRequest NONE = new DocumentRequest(false, DocumentFormat.PDF);

    public static DocumentRequest none() {
        return NONE;
    }
}
