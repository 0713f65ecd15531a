package dev.juridica.rag.chunking;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A piece of a {@link Document} produced by the {@link ChunkingEngine}. Chunks
 * are read-only once produced; merging creates new instances.
 */
public record Chunk(
        String content,
        String source,
        Integer page,
        Map<String, Object> metadata,
        int chunkId,
        int totalChunks,
        boolean merged,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<Integer> chunkIds) {

    public Chunk {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(source, "source");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        chunkIds = chunkIds == null ? null : List.copyOf(chunkIds);
    }

    /**
     * Wraps a whole document as the only chunk of itself.
     */
    public static Chunk of(Document document) {
        return of(document, document.content(), 0, 1);
    }

    static Chunk of(Document document, String content, int chunkId, int totalChunks) {
        return new Chunk(content, document.source(), document.page(), document.metadata(), chunkId, totalChunks,
                false, null);
    }

    /**
     * Label used when citing this chunk, e.g. {@code statuts.pdf (page 3)}.
     */
    @JsonIgnore
    public String sourceLabel() {
        return page != null ? source + " (page " + page + ")" : source;
    }

    /**
     * Stable identity of the chunk inside a collection.
     */
    @JsonIgnore
    public String key() {
        return source + "#" + (page != null ? page : "-") + "#" + chunkId;
    }

    Chunk absorb(Chunk next) {
        List<Integer> ids = new ArrayList<>(chunkIds != null ? chunkIds : List.of(chunkId));
        if (next.chunkIds() != null) {
            ids.addAll(next.chunkIds());
        } else {
            ids.add(next.chunkId());
        }
        return new Chunk(content + next.content(), source, page, metadata, chunkId, totalChunks, true, ids);
    }
}
