package dev.juridica.rag.document;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * What goes into a rendered answer document.
 */
public record DocumentContent(String title, String question, String answer, List<String> sources,
        OffsetDateTime generatedAt) {

    public DocumentContent {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
