package dev.juridica.rag.document;

/**
 * Descriptor of an answer document being rendered.
 */
public record GeneratedDocument(String format, String filename, String url) {
}
