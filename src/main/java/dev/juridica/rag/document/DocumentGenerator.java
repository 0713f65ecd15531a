package dev.juridica.rag.document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders an answer to a file.
 */
public interface DocumentGenerator {

    boolean supports(DocumentFormat format);

    void render(DocumentContent content, Path target) throws IOException;
}
