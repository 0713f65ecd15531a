package dev.juridica.rag.retrieval;

import java.util.Map;

import dev.juridica.rag.chunking.Chunk;
import jakarta.validation.constraints.NotBlank;

/**
 * Text of a document the caller extracted and attached to the question.
 */
public record ContextDocument(@NotBlank String content, String source, String mimeType, Long size) {

    Chunk toChunk() {
        Map<String, Object> metadata = mimeType == null ? Map.of() : Map.of("mime_type", mimeType);
        return new Chunk(content, source == null || source.isBlank() ? "document" : source, null, metadata, 0, 1,
                false, null);
    }
}
