package dev.juridica.rag.index;

import java.io.IOException;
import java.util.List;

import dev.juridica.rag.chunking.Chunk;

/**
 * Vector similarity index over chunks.
 */
public interface VectorIndex {

    /**
     * Embeds and stores the chunks, replacing chunks with the same key.
     */
    void upsert(List<Chunk> chunks);

    /**
     * Returns at most {@code k} documents, best first, each accepted by
     * {@link #comparator()} against {@code threshold} and unique per source
     * and page.
     */
    List<RetrievedDocument> search(String query, int k, double threshold);

    default List<RetrievedDocument> search(String query, int k) {
        return search(query, k, defaultThreshold());
    }

    void persist() throws IOException;

    void load() throws IOException;

    Origin origin();

    int size();

    ScoreComparator comparator();

    double defaultThreshold();
}
