package dev.juridica.rag.index;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.juridica.rag.chunking.Chunk;
import dev.juridica.rag.chunking.ChunkingEngine;
import dev.juridica.rag.chunking.Document;

/**
 * Ingests documents: normalizes and chunks them, merges small chunks and
 * writes the result into every configured backend. A failing backend is
 * reported and does not prevent the others from being updated.
 */
public class IndexingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexingService.class);

    private final ChunkingEngine chunkingEngine;
    private final List<VectorIndex> indexes;

    public IndexingService(ChunkingEngine chunkingEngine, List<VectorIndex> indexes) {
        this.chunkingEngine = Objects.requireNonNull(chunkingEngine, "chunkingEngine");
        this.indexes = List.copyOf(indexes);
    }

    public IndexingReport index(List<Document> documents) {
        List<Chunk> chunks = chunkingEngine.mergeSmall(chunkingEngine.process(documents));
        List<Origin> updated = new ArrayList<>();
        List<Origin> failed = new ArrayList<>();
        for (VectorIndex index : indexes) {
            try {
                index.upsert(chunks);
                index.persist();
                updated.add(index.origin());
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Indexing into {} failed: {}", index.origin(), ex.getMessage(), ex);
                failed.add(index.origin());
            }
        }
        LOGGER.info("Indexed {} documents as {} chunks (updated {}, failed {})", documents.size(), chunks.size(),
                updated, failed);
        return new IndexingReport(documents.size(), chunks.size(), updated, failed);
    }

    public record IndexingReport(int documents, int chunks, List<Origin> updated, List<Origin> failed) {

        public IndexingReport {
            updated = List.copyOf(updated);
            failed = List.copyOf(failed);
        }
    }
}
