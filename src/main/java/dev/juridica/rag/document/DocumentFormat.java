package dev.juridica.rag.document;

/**
 * Output formats a user can ask for.
 */
public enum DocumentFormat {
    PDF("pdf"),
    DOCX("docx");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
