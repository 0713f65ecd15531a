package dev.juridica.rag.chunking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source text handed to the chunking engine, together with the label used for
 * citations and an optional page number.
 */
public record Document(String content, String source, Integer page, Map<String, Object> metadata) {

    public Document {
        Objects.requireNonNull(content, "content");
        source = source == null || source.isBlank() ? "unknown" : source;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Document(String content, String source) {
        this(content, source, null, Map.of());
    }

    public Document(String content, String source, Integer page) {
        this(content, source, page, Map.of());
    }

    Document withContent(String newContent) {
        return new Document(newContent, source, page, metadata);
    }
}
