package dev.juridica.rag.knowledge;

import java.util.Map;

import dev.juridica.rag.chunking.Document;
import jakarta.validation.constraints.NotBlank;

/**
 * Document submitted for ingestion.
 */
public record KnowledgeDocument(@NotBlank String content, String source, Integer page, Map<String, Object> metadata) {

    Document toDocument() {
        return new Document(content, source, page, metadata);
    }
}
